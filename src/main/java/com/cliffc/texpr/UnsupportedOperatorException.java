package com.cliffc.texpr;

import com.cliffc.texpr.node.Kind;

/** Raised by the operator factory for a node kind that is not a binary
 *  operator.  Fatal, same as {@link UnsupportedDtypeException}. */
public class UnsupportedOperatorException extends TXException {
  public final Kind _kind;
  public UnsupportedOperatorException( Kind kind ) {
    super("Unsupported operator: "+kind);
    _kind = kind;
  }
}
