package dev.quire.document;

/**
 * Raised when an input cannot be turned into a {@link LineIndexedDocument}, for example because it
 * is empty. Fatal for the chunking run and propagated to the caller.
 */
public class DocumentException extends RuntimeException {

  public DocumentException(String message) {
    super(message);
  }
}
