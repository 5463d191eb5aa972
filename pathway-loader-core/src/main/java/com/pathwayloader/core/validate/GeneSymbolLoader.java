package com.pathwayloader.core.validate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads a {@link GeneSymbolAuthority} from disk.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li>a plain list with one symbol per line</li>
 *   <li>a tab separated export (e.g. from HGNC) whose header row names the symbol column</li>
 * </ul>
 * Blank lines and lines starting with {@code #} are skipped in both.
 */
public class GeneSymbolLoader {

    private static final Logger log = LoggerFactory.getLogger(GeneSymbolLoader.class);

    private final String symbolColumn;

    public GeneSymbolLoader(String symbolColumn) {
        this.symbolColumn = symbolColumn == null ? "symbol" : symbolColumn;
    }

    /**
     * Reads the symbol file.
     *
     * @param file symbol list or TSV export
     * @return authority holding every symbol found
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a TSV export lacks the symbol column
     */
    public GeneSymbolAuthority load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
            .filter(line -> !line.isBlank() && !line.startsWith("#"))
            .toList();

        Set<String> symbols = new LinkedHashSet<>();
        if (!lines.isEmpty() && lines.get(0).contains("\t")) {
            String[] header = lines.get(0).split("\t", -1);
            int column = indexOf(header, symbolColumn);
            if (column < 0) {
                throw new IllegalArgumentException("Column '" + symbolColumn + "' not found in " + file);
            }
            for (String line : lines.subList(1, lines.size())) {
                String[] cells = line.split("\t", -1);
                if (column < cells.length && !cells[column].isBlank()) {
                    symbols.add(cells[column].trim());
                }
            }
        } else {
            lines.forEach(line -> symbols.add(line.trim()));
        }

        log.info("Loaded {} gene symbols from {}", symbols.size(), file);
        return GeneSymbolAuthority.of(symbols);
    }

    private static int indexOf(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }
}
