package guraa.docxcompare.exception;

/**
 * Thrown when an input document is structurally unusable: no main part,
 * XML that does not parse, or a main part without a body.
 */
public class MalformedDocumentException extends RuntimeException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
