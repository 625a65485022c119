package com.cliffc.texpr;

// Badly built expression: mismatched lanes, bitwise ops on floats, non-handle
// load bases, or a syntax error from the parser.
public class MalformedInputException extends TXException {
  public MalformedInputException( String msg ) { super(msg); }
}
