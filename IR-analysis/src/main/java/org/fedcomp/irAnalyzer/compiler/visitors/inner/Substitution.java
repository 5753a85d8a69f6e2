package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import java.util.HashMap;

/** The bindings introduced by a single scope. */
public class Substitution<K, V> extends HashMap<K, V> {
    public void substitute(K name, V value) {
        this.put(name, value);
    }
}
