package org.fedcomp.util;

/** An object that can render itself on an {@link IIndentStream}. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
