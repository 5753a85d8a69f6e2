package org.fedcomp.util;

/** An object with a unique numeric id. */
public interface IHasId {
    long getId();
}
