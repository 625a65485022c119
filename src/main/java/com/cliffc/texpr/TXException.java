package com.cliffc.texpr;

// Root of all errors raised while building, evaluating or folding expressions.
// Unchecked; nothing in the folding pass recovers from one.
public class TXException extends RuntimeException {
  public TXException( String msg ) { super(msg); }
}
