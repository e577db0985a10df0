package infra.log;

import domain.model.Diagnostic;
import domain.model.DiagnosticSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every diagnostic at the level matching its severity, then forwards it.
 */
public final class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger("diagnostics");

    private final DiagnosticSink delegate;

    public LoggingDiagnosticSink(DiagnosticSink delegate) {
        this.delegate = delegate == null ? DiagnosticSink.none() : delegate;
    }

    @Override
    public void report(Diagnostic diagnostic) {
        if (diagnostic == null) return;

        switch (diagnostic.getSeverity()) {
            case ERROR:
                log.error("{}", diagnostic);
                break;
            case WARN:
                log.warn("{}", diagnostic);
                break;
            default:
                log.info("{}", diagnostic);
                break;
        }
        delegate.report(diagnostic);
    }
}
