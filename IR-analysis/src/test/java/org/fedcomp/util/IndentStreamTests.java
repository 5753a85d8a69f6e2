package org.fedcomp.util;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class IndentStreamTests {
    @Test
    public void testIndent() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        builder.setIndentAmount(2);
        builder.append("a").increase()
                .append("b").newline()
                .append("c").decrease().newline()
                .append("d");
        Assert.assertEquals("a\n  b\n  c\nd", builder.toString());
    }

    @Test
    public void testSingleLine() {
        IndentStreamBuilder builder = IndentStreamBuilder.singleLine();
        builder.append("a").increase().append("b").newline().append(3);
        Assert.assertEquals("ab3", builder.toString());
    }

    @Test
    public void testNullStream() {
        IIndentStream stream = new NullIndentStream();
        Assert.assertSame(stream, stream.append("a").newline().appendSupplier(() -> {
            throw new AssertionError("supplier must not be invoked");
        }));
    }

    @Test
    public void testLinq() {
        List<Integer> data = Arrays.asList(1, 2, 3);
        Assert.assertEquals(Arrays.asList("1", "2", "3"), Linq.map(data, Object::toString));
        Assert.assertEquals(List.of(2), Linq.where(data, x -> x % 2 == 0));
        Assert.assertTrue(Linq.any(data, x -> x > 2));
        Assert.assertFalse(Linq.all(data, x -> x > 2));
        Assert.assertTrue(Linq.same(data, data));
    }
}
