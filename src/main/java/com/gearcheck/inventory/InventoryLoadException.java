package com.gearcheck.inventory;

/**
 * Fatal failure while loading the inventory table. A partial inventory would under-report
 * orphans, so the whole load is abandoned.
 */
public class InventoryLoadException extends RuntimeException {
    public static final String ERR_UNREADABLE = "inventory_unreadable";
    public static final String ERR_MALFORMED_ROW = "inventory_malformed_row";

    private final String errorCode;
    private final int rowNumber;

    public InventoryLoadException(String errorCode, int rowNumber, String message) {
        super(message);
        this.errorCode = errorCode;
        this.rowNumber = rowNumber;
    }

    public InventoryLoadException(String errorCode, int rowNumber, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.rowNumber = rowNumber;
    }

    public static InventoryLoadException unreadable(String message, Throwable cause) {
        return new InventoryLoadException(ERR_UNREADABLE, 0, message, cause);
    }

    public static InventoryLoadException malformedRow(int rowNumber, String message) {
        return new InventoryLoadException(ERR_MALFORMED_ROW, rowNumber, "Row " + rowNumber + ": " + message);
    }

    public String getErrorCode() {
        return errorCode;
    }

    /** 1-based data row, or 0 when the failure is not tied to a row. */
    public int getRowNumber() {
        return rowNumber;
    }
}
