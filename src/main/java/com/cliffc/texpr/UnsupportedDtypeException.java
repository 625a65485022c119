package com.cliffc.texpr;

import com.cliffc.texpr.type.Dtype;

/** Raised when the constant evaluator meets a scalar type it has no typed
 *  computation for.  Fatal: a new type was added without updating the
 *  evaluator dispatch. */
public class UnsupportedDtypeException extends TXException {
  public final Dtype _dtype;
  public UnsupportedDtypeException( Dtype dtype ) {
    super("Unsupported dtype: "+dtype);
    _dtype = dtype;
  }
}
