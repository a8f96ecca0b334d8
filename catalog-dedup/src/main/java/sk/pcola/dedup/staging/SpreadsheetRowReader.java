package sk.pcola.dedup.staging;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Číta všetky riadky všetkých hárkov tabuľkového súboru.
 */
public interface SpreadsheetRowReader {

    /**
     * @param file     cesta k súboru
     * @param consumer dostane hodnoty buniek riadku ako text, v poradí zo súboru
     * @return počet prečítaných riadkov
     * @throws IOException ak sa súbor nedá otvoriť
     */
    int read(Path file, Consumer<List<String>> consumer) throws IOException;
}
