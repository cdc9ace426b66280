package io.hearthwarrio.formweaver.core.model;

/**
 * Position of a control inside a repeating table.
 * <p>
 * Row and column indexes are 0-based and relative to the table body.
 */
public final class TableContext {

    private final int rowIndex;
    private final int columnIndex;
    private final String tableId;
    private final String columnHeader;

    public TableContext(int rowIndex, int columnIndex, String tableId, String columnHeader) {
        this.rowIndex = rowIndex;
        this.columnIndex = columnIndex;
        this.tableId = tableId == null ? "" : tableId;
        this.columnHeader = columnHeader == null ? "" : columnHeader.trim();
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public String getTableId() {
        return tableId;
    }

    public String getColumnHeader() {
        return columnHeader;
    }

    @Override
    public String toString() {
        return "TableContext{" +
                "row=" + rowIndex +
                ", column=" + columnIndex +
                ", tableId='" + tableId + '\'' +
                ", header='" + columnHeader + '\'' +
                '}';
    }
}
