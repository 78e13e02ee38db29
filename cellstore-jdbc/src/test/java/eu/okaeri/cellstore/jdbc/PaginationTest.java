package eu.okaeri.cellstore.jdbc;

import eu.okaeri.cellstore.StoreCell;
import eu.okaeri.cellstore.config.CellConfig;
import eu.okaeri.cellstore.document.DocumentRecord;
import eu.okaeri.cellstore.document.IngestResult;
import eu.okaeri.cellstore.filter.Page;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PaginationTest extends AbstractH2Test {

    private StoreCell ingest(int documents) {
        StoreCell cell = this.store.open("pages", CellConfig.of("store.v1", Collections.singletonList("group")));
        for (int i = 0; i < documents; i++) {
            cell.ingest("{\"id\":\"doc_" + i + "\",\"group\":\"" + ((i % 2 == 0) ? "even" : "odd") + "\"}");
        }
        return cell;
    }

    private static List<String> drain(StoreCell cell, Map<String, String> filters, int limit) {

        List<String> seen = new ArrayList<>();
        filters.put("limit", String.valueOf(limit));

        Page page = cell.list(filters);
        while (true) {
            assertThat(page.getRecords()).hasSizeLessThanOrEqualTo(limit);
            page.getRecords().forEach(record -> seen.add(record.getExternalId()));
            if (!page.hasNext()) {
                break;
            }
            filters.put("after", page.getNextAfter());
            page = cell.list(filters);
        }
        return seen;
    }

    @ParameterizedTest
    @CsvSource({"7, 3", "6, 3", "5, 1", "4, 200", "0, 5"})
    void pages_cover_every_document_exactly_once(int documents, int limit) {

        StoreCell cell = this.ingest(documents);

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < documents; i++) {
            expected.add("doc_" + i);
        }
        assertThat(drain(cell, filters(), limit)).containsExactlyElementsOf(expected);
    }

    @Test
    void pages_respect_filters() {
        StoreCell cell = this.ingest(9);
        assertThat(drain(cell, filters("group", "odd"), 2)).containsExactly("doc_1", "doc_3", "doc_5", "doc_7");
    }

    @Test
    void next_after_is_last_id_of_full_page() {

        StoreCell cell = this.ingest(3);
        Page page = cell.list(filters("limit", "2"));

        assertThat(page.getRecords()).hasSize(2);
        assertThat(page.getNextAfter()).isEqualTo(page.getRecords().get(1).getId());
        assertThat(cell.list(filters("after", page.getNextAfter())).getRecords())
            .extracting(DocumentRecord::getExternalId).containsExactly("doc_2");
    }

    @Test
    void limit_is_clamped() {
        StoreCell cell = this.ingest(3);
        assertThat(cell.list(filters("limit", "0")).getRecords()).hasSize(1);
        assertThat(cell.list(filters("limit", "-4")).getRecords()).hasSize(1);
        assertThat(cell.list(filters("limit", "abc")).getRecords()).hasSize(3);
    }

    @Test
    void ids_sort_in_ingestion_order() {
        StoreCell cell = this.store.open("ordered", CellConfig.defaults());
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            IngestResult result = cell.ingest("{\"n\":" + i + "}");
            ids.add(result.getId());
        }
        assertThat(ids).isSorted();
        assertThat(cell.list(filters("limit", "50")).getRecords()).extracting(DocumentRecord::getId).containsExactlyElementsOf(ids);
    }
}
