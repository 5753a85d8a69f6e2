package org.fedcomp.irAnalyzer.compiler.visitors.inner;

import org.fedcomp.irAnalyzer.compiler.errors.InternalCompilerError;
import org.junit.Assert;
import org.junit.Test;

public class ScopesTests {
    @Test
    public void testShadowing() {
        Scopes<String, Boolean> scopes = new Scopes<>();
        scopes.newContext();
        scopes.substitute("x", true);
        scopes.substitute("y", true);
        scopes.newContext();
        scopes.substitute("x", false);
        Assert.assertEquals(2, scopes.depth());
        Assert.assertEquals(false, scopes.get("x"));
        Assert.assertEquals(true, scopes.get("y"));
        Assert.assertNull(scopes.get("z"));
        scopes.popContext();
        Assert.assertEquals(true, scopes.get("x"));
        scopes.popContext();
        scopes.mustBeEmpty();
    }

    @Test
    public void testEmpty() {
        Scopes<String, Boolean> scopes = new Scopes<>();
        Assert.assertThrows(InternalCompilerError.class, scopes::popContext);
        Assert.assertThrows(InternalCompilerError.class, () -> scopes.substitute("x", true));
        scopes.newContext();
        Assert.assertThrows(InternalCompilerError.class, scopes::mustBeEmpty);
    }
}
