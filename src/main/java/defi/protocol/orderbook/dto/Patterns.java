package defi.protocol.orderbook.dto;

/**
 * Validation patterns shared by request DTOs
 */
final class Patterns {

    static final String ADDRESS = "^0x[0-9a-fA-F]{40}$";

    /**
     * Up to 78 decimal digits, enough for any uint256
     */
    static final String UINT = "^[0-9]{1,78}$";

    private Patterns() {
    }
}
