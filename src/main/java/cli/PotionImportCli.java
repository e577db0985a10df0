package cli;

import app.PotionImportCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Option parsing, path resolution and reporting live in {@link PotionImportCliApp};
 * this class only keeps the stable main-class name used by the jar manifest.</p>
 */
public class PotionImportCli {

    public static void main(String[] args) {
        PotionImportCliApp.main(args);
    }
}
