package dev.quire.chunking.size;

import dev.quire.document.LineIndexedDocument;

/**
 * Approximates the number of LLM tokens a span of text will cost.
 *
 * <p>Estimates are deterministic and monotonic so that the splitter can binary-search the last line
 * fitting a budget.
 */
public interface SizeEstimator {

  /** Estimates the token cost of free text. */
  int estimateText(CharSequence text);

  /** Binds this estimator to a document, returning a range sizer over its lines. */
  DocumentSizer forDocument(LineIndexedDocument document);
}
