package me.christianrobert.substation.dsl.ir;

/**
 * One position in a {@link ConnectionChain}: either an {@link ObjectRef} or a {@link Terminal}.
 */
public interface ChainElement {

    boolean isTerminal();
}
