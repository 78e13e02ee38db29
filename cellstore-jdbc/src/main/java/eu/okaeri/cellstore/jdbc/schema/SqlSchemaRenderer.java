package eu.okaeri.cellstore.jdbc.schema;

import eu.okaeri.cellstore.index.IndexColumn;
import eu.okaeri.cellstore.index.TableShape;
import eu.okaeri.cellstore.variant.PromotedField;
import eu.okaeri.cellstore.variant.PromotedType;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

import static eu.okaeri.cellstore.jdbc.commons.JdbcHelper.quote;

/**
 * DDL of a cell: {@code <cell>_meta} (key/value), {@code <cell>_documents} and
 * {@code <cell>_elements}, the last two shaped by the {@link TableShape}.
 */
@Getter
public class SqlSchemaRenderer {

    public static final int ID_LENGTH = 36;

    private final String metaTable;
    private final String documentTable;
    private final String elementTable;

    public SqlSchemaRenderer(@NonNull String tablePrefix, @NonNull String cellName) {
        String base = tablePrefix + cellName;
        this.metaTable = base + "_meta";
        this.documentTable = base + "_documents";
        this.elementTable = base + "_elements";
    }

    public String createMetaTable() {
        return "create table if not exists " + quote(this.metaTable) + " (" +
            "\"k\" varchar(64) primary key not null," +
            "\"v\" clob)";
    }

    public List<String> createTables(@NonNull TableShape shape, @NonNull List<PromotedField> promoted, boolean contentIndex) {

        List<String> statements = new ArrayList<>();
        String documents = quote(this.documentTable);
        String elements = quote(this.elementTable);

        StringBuilder documentSql = new StringBuilder("create table if not exists ").append(documents).append(" (")
            .append("\"id\" varchar(").append(ID_LENGTH).append(") primary key not null,")
            .append("\"external_id\" varchar,")
            .append("\"ingested_at\" bigint not null,")
            .append("\"schema_version\" varchar(16) not null,");
        for (PromotedField field : promoted) {
            documentSql.append(quote(field.getName())).append(' ')
                .append((field.getType() == PromotedType.NUMBER) ? "decfloat" : "varchar")
                .append(field.isRequired() ? " not null," : ",");
        }
        documentSql.append("\"body\" clob not null");
        for (IndexColumn column : shape.getDocumentColumns()) {
            documentSql.append(',').append(quote(column.getName())).append(" varchar");
        }
        statements.add(documentSql.append(')').toString());

        statements.add(this.createIndex(this.documentTable, "external_id"));
        for (PromotedField field : promoted) {
            statements.add(this.createIndex(this.documentTable, field.getName()));
        }
        for (IndexColumn column : shape.getDocumentColumns()) {
            statements.add(this.createIndex(this.documentTable, column.getName()));
        }

        if (!shape.hasRepeatingField()) {
            return statements;
        }

        StringBuilder elementSql = new StringBuilder("create table if not exists ").append(elements).append(" (")
            .append("\"parent_id\" varchar(").append(ID_LENGTH).append(") not null references ")
            .append(documents).append("(\"id\") on delete cascade,")
            .append("\"position\" int not null,")
            .append("\"type\" varchar,")
            .append("\"role\" varchar,")
            .append("\"status\" varchar,")
            .append("\"content_excerpt\" varchar,")
            .append("\"content_size_estimate\" int,");
        for (IndexColumn column : shape.getElementColumns()) {
            elementSql.append(quote(column.getName())).append(" varchar,");
        }
        statements.add(elementSql.append("primary key (\"parent_id\", \"position\"))").toString());

        statements.add(this.createIndex(this.elementTable, "parent_id"));
        statements.add(this.createIndex(this.elementTable, "type"));
        statements.add(this.createIndex(this.elementTable, "role"));
        statements.add(this.createIndex(this.elementTable, "status"));
        if (contentIndex) {
            statements.add(this.createIndex(this.elementTable, "content_excerpt"));
        }
        for (IndexColumn column : shape.getElementColumns()) {
            statements.add(this.createIndex(this.elementTable, column.getName()));
        }

        return statements;
    }

    /**
     * Element table first, it references the document table.
     */
    public List<String> dropTables() {
        List<String> statements = new ArrayList<>();
        statements.add("drop table if exists " + quote(this.elementTable));
        statements.add("drop table if exists " + quote(this.documentTable));
        return statements;
    }

    public String writeMeta() {
        return "merge into " + quote(this.metaTable) + " (\"k\", \"v\") key (\"k\") values (?, ?)";
    }

    public String readMeta() {
        return "select \"v\" from " + quote(this.metaTable) + " where \"k\" = ?";
    }

    private String createIndex(String table, String column) {
        return "create index if not exists " + quote("idx_" + table + "_" + column) + " on " + quote(table) + " (" + quote(column) + ")";
    }
}
