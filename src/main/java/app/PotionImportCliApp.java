package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.PotionImportCli;
import domain.grid.CellStore;
import domain.grid.WorkbookIndex;
import domain.importer.ImportReport;
import domain.importer.ImportSettings;
import domain.importer.PotionImporter;
import domain.item.ItemCatalog;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;
import domain.model.ListDiagnosticSink;
import domain.recipe.RecipeIndex;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/** CLI entry (invoked by {@link PotionImportCli}). */
public final class PotionImportCliApp {

    public static final String DEFAULT_WORKBOOK = "data/PotionCrafting.xlsx";
    public static final String DEFAULT_OUT = "output/catalog";

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_DIAGNOSTIC_ERRORS = 2;

    private PotionImportCliApp() {}

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    /**
     * Runs one import and returns the process exit code.
     * <ul>
     *   <li>0: done (diagnostics may have been reported)</li>
     *   <li>1: the run failed (missing workbook, unreadable file, write error)</li>
     *   <li>2: done, but {@code --failOnError} was given and an ERROR diagnostic was reported</li>
     * </ul>
     */
    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / input / output
        // ------------------------------------------------------------
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        Path workbookPath = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "workbook", DEFAULT_WORKBOOK));
        Path outDir = CliPathResolver.resolvePath(baseDir, CliArgParser.option(argv, "out", DEFAULT_OUT));
        String saveRaw = CliArgParser.option(argv, "saveWorkbook", null);
        Path savePath = (saveRaw == null) ? null : CliPathResolver.resolvePath(baseDir, saveRaw);

        ImportSettings settings = new ImportSettings(
                CliArgParser.option(argv, "ingredientsTable", null),
                CliArgParser.option(argv, "potionsTable", null),
                CliArgParser.option(argv, "recipesTable", null)
        );
        boolean failOnError = CliArgParser.flag(argv, "failOnError")
                || CliArgParser.parseBoolean(System.getProperty("failOnError"), false);

        System.out.println("==================================================");
        System.out.println("[START] Potion workbook import");
        System.out.println("[CONF] baseDir          = " + baseDir);
        System.out.println("[CONF] workbook         = " + workbookPath);
        System.out.println("[CONF] out              = " + outDir);
        System.out.println("[CONF] saveWorkbook     = " + (savePath == null ? "(skip)" : savePath));
        System.out.println("[CONF] ingredientsTable = " + settings.getIngredientsTable());
        System.out.println("[CONF] potionsTable     = " + settings.getPotionsTable());
        System.out.println("[CONF] recipesTable     = " + settings.getRecipesTable());
        System.out.println("[CONF] failOnError      = " + failOnError + " (use --failOnError)");
        System.out.println("==================================================");

        try {
            CliPathResolver.validateFileExists(workbookPath, "workbook (--workbook)");
        } catch (IllegalArgumentException e) {
            System.out.println("[ERROR] " + e.getMessage());
            return EXIT_FAILED;
        }

        ListDiagnosticSink collected = new ListDiagnosticSink();
        PotionImportComponentsFactory factory = new PotionImportComponentsFactory();
        DiagnosticSink sink = factory.createSink(collected);

        try {
            long tRead0 = System.nanoTime();
            CellStore store = factory.readWorkbook(workbookPath);
            WorkbookIndex workbook = factory.createWorkbookIndex(store, sink);
            System.out.println("[STEP1] workbook loaded. tables=" + workbook.tableNames()
                    + ", ranges=" + workbook.rangeNames().size() + ", elapsed=" + ms(tRead0) + "ms");

            long tImport0 = System.nanoTime();
            ItemCatalog items = factory.createItemCatalog();
            RecipeIndex recipes = factory.createRecipeIndex(sink);
            PotionImporter importer = factory.createImporter(settings, sink);
            ImportReport report = importer.importAll(workbook, items, recipes);
            System.out.println("[STEP2] import done. items=" + items.size() + ", recipes=" + recipes.size()
                    + ", elapsed=" + ms(tImport0) + "ms");
            System.out.println("[STAT] " + report);

            long tOut0 = System.nanoTime();
            factory.createCatalogWriter().write(outDir, items, recipes);
            System.out.println("[STEP3] catalog written. dir=" + outDir + ", elapsed=" + ms(tOut0) + "ms");

            if (savePath != null) {
                long tSave0 = System.nanoTime();
                workbook.save(factory.createWorkbookSaver(), savePath);
                System.out.println("[STEP4] workbook saved. path=" + savePath + ", elapsed=" + ms(tSave0) + "ms");
            } else {
                System.out.println("[STEP4] workbook save skipped (use --saveWorkbook=<path>)");
            }

        } catch (RuntimeException e) {
            System.out.println("[ERROR] import failed: " + e.getClass().getSimpleName() + ": " + safe(e.getMessage()));
            e.printStackTrace(System.out);
            return EXIT_FAILED;
        }

        printDiagnosticSummary(collected);

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");

        if (failOnError && collected.hasErrors()) {
            System.out.println("[FAIL] ERROR diagnostics reported and --failOnError is set.");
            return EXIT_DIAGNOSTIC_ERRORS;
        }
        return EXIT_OK;
    }

    private static void printDiagnosticSummary(ListDiagnosticSink collected) {
        System.out.println("[STAT] diagnostics=" + collected.size());
        if (collected.size() == 0) return;

        Map<DiagnosticCode, Integer> byCode = new EnumMap<>(DiagnosticCode.class);
        for (Diagnostic d : collected.getDiagnostics()) {
            byCode.merge(d.getCode(), 1, Integer::sum);
        }
        for (Map.Entry<DiagnosticCode, Integer> e : byCode.entrySet()) {
            System.out.println("[STAT]   " + e.getKey() + " (" + e.getKey().getSeverity() + ") = " + e.getValue());
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }
}
