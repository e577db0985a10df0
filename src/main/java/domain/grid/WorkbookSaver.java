package domain.grid;

import java.nio.file.Path;

/** Serializes a whole cell store to a file. */
public interface WorkbookSaver {

    void save(CellStore store, Path destination);
}
