package com.cliffc.texpr;

import com.cliffc.texpr.node.Expr;
import com.cliffc.texpr.pass.ConstantFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Scanner;

/** Constant folding for tensor expressions.
 *  <p>
 *  Command line: each argument is parsed as an expression, folded, and the
 *  result printed.  With no arguments, reads expressions a line at a time
 *  from stdin.  {@code -v} also echoes the unfolded input.
 */
public abstract class TX {
  private static final Logger LOG = LoggerFactory.getLogger(TX.class);

  public static RuntimeException unimpl() { return unimpl("unimplemented"); }
  public static RuntimeException unimpl( String msg ) { return new RuntimeException(msg); }

  public static final String prompt="> ";

  public static void main( String[] args ) {
    boolean verbose = false;
    ArrayList<String> exprs = new ArrayList<>();
    for( String arg : args )
      if( arg.equals("-v") ) verbose = true;
      else exprs.add(arg);
    if( exprs.isEmpty() ) { repl(verbose); return; }
    for( String expr : exprs )
      System.out.println(go_one("args",expr,verbose));
  }

  // Fold a line at a time from stdin, with a prompt
  static void repl( boolean verbose ) {
    System.out.print(prompt);
    System.out.flush();
    Scanner stdin = new Scanner(System.in);
    while( stdin.hasNextLine() ) {
      String line = stdin.nextLine();
      if( !line.isBlank() )
        System.out.println(go_one("stdin",line,verbose));
      System.out.print(prompt);
      System.out.flush();
    }
  }

  // Parse and fold one expression.  Errors come back as the printed result.
  static String go_one( String src, String line, boolean verbose ) {
    try {
      Expr e = new Parse(src,line).go();
      Expr f = ConstantFolder.simplify(e);
      return verbose ? e+" => "+f : f.toString();
    } catch( TXException tx ) {
      LOG.debug("Failed to fold '{}'",line,tx);
      return tx.getMessage();
    }
  }
}
