package org.fedcomp.util;

import org.fedcomp.irAnalyzer.compiler.TreeAnalysis;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.CountNodes;
import org.fedcomp.irAnalyzer.compiler.visitors.inner.InnerVisitor;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicReference;

public class LoggerTests {
    @After
    public void resetLogging() {
        Logger.INSTANCE.reset();
    }

    @Test
    public void testLevels() {
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(CountNodes.class));
        Assert.assertEquals(0, Logger.INSTANCE.setLoggingLevel(InnerVisitor.class, 2));
        Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(CountNodes.class));
        Assert.assertEquals(2, Logger.INSTANCE.setLoggingLevel("InnerVisitor", 3));
        Assert.assertEquals(0, Logger.INSTANCE.getLoggingLevel(TreeAnalysis.class));
    }

    @Test
    public void testReadWhileConfiguring() throws InterruptedException {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread writer = new Thread(() -> {
            try {
                for (int i = 0; i < 20000; i++) {
                    Logger.INSTANCE.setLoggingLevel(InnerVisitor.class, i % 3);
                    Logger.INSTANCE.setLoggingLevel(TreeAnalysis.class, i % 2);
                    if (i % 100 == 0)
                        Logger.INSTANCE.reset();
                }
            } catch (Throwable ex) {
                failure.set(ex);
            }
        });
        writer.start();
        for (int i = 0; i < 20000; i++)
            Logger.INSTANCE.getLoggingLevel(CountNodes.class);
        writer.join();
        Assert.assertNull(failure.get());
    }
}
