package com.cliffc.texpr;

// Interpreter failure: unbound variable or buffer, or an out-of-range load.
public class EvalException extends TXException {
  public EvalException( String msg ) { super(msg); }
}
