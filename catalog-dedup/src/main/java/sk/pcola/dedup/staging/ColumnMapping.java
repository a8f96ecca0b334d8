package sk.pcola.dedup.staging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Indexy stĺpcov (od 0) so značkou, artiklom a názvom v jednom cenníku.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ColumnMapping(
        @JsonProperty("brand") int brand,
        @JsonProperty("article") int article,
        @JsonProperty("name") int name
) {

    public int maxIndex() {
        return Math.max(brand, Math.max(article, name));
    }

    /**
     * Riadok musí obsahovať aspoň stĺpec s najvyšším indexom.
     */
    public boolean fits(int rowSize) {
        return rowSize > maxIndex();
    }

    public boolean isValid() {
        return brand >= 0 && article >= 0 && name >= 0;
    }
}
