package skycutout.pipeline.catalog;

import skycutout.pipeline.model.CatalogRow;
import skycutout.pipeline.model.CatalogSummary;

import java.util.List;

/**
 * Rows that passed validation, ready for key derivation.
 */
public record ValidatedCatalog(List<CatalogRow> rows, CatalogSummary summary) {

    public ValidatedCatalog {
        rows = List.copyOf(rows);
    }
}
