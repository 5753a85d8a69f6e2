package org.fedcomp.irAnalyzer.compiler;

import org.fedcomp.irAnalyzer.TreeFixtures;
import org.fedcomp.irAnalyzer.compiler.errors.InvalidArgumentError;
import org.fedcomp.irAnalyzer.compiler.errors.PlacementMismatchError;
import org.fedcomp.irAnalyzer.ir.expression.FedCall;
import org.fedcomp.irAnalyzer.ir.expression.FedData;
import org.fedcomp.irAnalyzer.ir.expression.FedLambda;
import org.fedcomp.irAnalyzer.ir.expression.FedTuple;
import org.fedcomp.irAnalyzer.ir.type.Placement;
import org.junit.Assert;
import org.junit.Test;

public class SinglePlacementTests {
    @Test
    public void testSinglePlacementPasses() {
        FedTuple tuple = new FedTuple(
                new FedData("a", TreeFixtures.INT_AT_CLIENTS),
                new FedData("b", TreeFixtures.INT),
                new FedLambda("x", TreeFixtures.INT_AT_CLIENTS, new FedData("c", TreeFixtures.INT_AT_CLIENTS)));
        TreeAnalysis.checkHasSinglePlacement(tuple, Placement.CLIENTS);
    }

    @Test
    public void testNoFederatedValuePasses() {
        TreeAnalysis.checkHasSinglePlacement(TreeFixtures.nestedTree(), Placement.SERVER);
        TreeAnalysis.checkHasSinglePlacement(TreeFixtures.nestedTree(), Placement.CLIENTS);
    }

    @Test
    public void testMixedPlacementFails() {
        FedData server = new FedData("b", TreeFixtures.INT_AT_SERVER);
        FedTuple tuple = new FedTuple(new FedData("a", TreeFixtures.INT_AT_CLIENTS), server);
        PlacementMismatchError error = Assert.assertThrows(PlacementMismatchError.class,
                () -> TreeAnalysis.checkHasSinglePlacement(tuple, Placement.CLIENTS));
        Assert.assertSame(server, error.getFedNode());
        Assert.assertEquals(Placement.CLIENTS, error.expected);
        Assert.assertEquals(Placement.SERVER, error.found);
        Assert.assertTrue(error.getMessage().contains("placement other than CLIENTS"));
        Assert.assertTrue(error.getMessage().contains("placement SERVER on expression b"));
    }

    @Test
    public void testBroadcastSpansPlacements() {
        FedCall broadcast = TreeFixtures.calledFederatedBroadcast();
        // The argument is at the server
        PlacementMismatchError clients = Assert.assertThrows(PlacementMismatchError.class,
                () -> TreeAnalysis.checkHasSinglePlacement(broadcast, Placement.CLIENTS));
        Assert.assertSame(broadcast.argument, clients.getFedNode());
        // The result is at the clients
        PlacementMismatchError server = Assert.assertThrows(PlacementMismatchError.class,
                () -> TreeAnalysis.checkHasSinglePlacement(broadcast, Placement.SERVER));
        Assert.assertSame(broadcast, server.getFedNode());
        Assert.assertEquals("Placement mismatch", server.getErrorKind());
    }

    @Test
    public void testNullArguments() {
        Assert.assertThrows(InvalidArgumentError.class,
                () -> TreeAnalysis.checkHasSinglePlacement(null, Placement.SERVER));
        Assert.assertThrows(InvalidArgumentError.class,
                () -> TreeAnalysis.checkHasSinglePlacement(TreeFixtures.nestedTree(), null));
    }
}
