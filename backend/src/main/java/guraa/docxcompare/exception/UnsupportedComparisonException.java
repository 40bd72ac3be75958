package guraa.docxcompare.exception;

/**
 * Thrown for engine and reconstruction mode combinations that cannot be served.
 */
public class UnsupportedComparisonException extends RuntimeException {

    public UnsupportedComparisonException(String message) {
        super(message);
    }
}
