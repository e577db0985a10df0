package app;

import domain.grid.CellStore;
import domain.grid.WorkbookIndex;
import domain.grid.WorkbookSaver;
import domain.importer.ImportSettings;
import domain.importer.PotionImporter;
import domain.item.ItemCatalog;
import domain.model.DiagnosticSink;
import domain.recipe.RecipeIndex;
import infra.catalog.CatalogCsvWriter;
import infra.log.LoggingDiagnosticSink;
import infra.xlsx.XlsxCellStoreReader;
import infra.xlsx.XlsxCellStoreWriter;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link PotionImportCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration and console output; object creation
 * and wiring live here.
 */
final class PotionImportComponentsFactory {

    DiagnosticSink createSink(DiagnosticSink collector) {
        return new LoggingDiagnosticSink(collector);
    }

    CellStore readWorkbook(Path workbookPath) {
        return new XlsxCellStoreReader().read(workbookPath);
    }

    WorkbookIndex createWorkbookIndex(CellStore store, DiagnosticSink sink) {
        return WorkbookIndex.load(store, sink);
    }

    ItemCatalog createItemCatalog() {
        return new ItemCatalog();
    }

    RecipeIndex createRecipeIndex(DiagnosticSink sink) {
        return new RecipeIndex(sink);
    }

    PotionImporter createImporter(ImportSettings settings, DiagnosticSink sink) {
        return new PotionImporter(settings, sink);
    }

    CatalogCsvWriter createCatalogWriter() {
        return new CatalogCsvWriter();
    }

    WorkbookSaver createWorkbookSaver() {
        return new XlsxCellStoreWriter();
    }
}
