package com.questrail.tao.runtime;

import com.questrail.tao.api.DecodedValue;
import com.questrail.tao.api.NumericMatrix;
import com.questrail.tao.api.Parameter;
import com.questrail.tao.api.PropertyMap;
import com.questrail.tao.api.ProtocolIssue;
import com.questrail.tao.config.TaoSessionConfig;
import com.questrail.tao.internal.time.ManualWallClock;
import com.questrail.tao.observability.CommandEvent;
import com.questrail.tao.observability.ProtocolIssueEvent;
import com.questrail.tao.observability.RecordingObservabilitySink;
import com.questrail.tao.protocol.decode.ConsistencyException;
import com.questrail.tao.protocol.decode.DecodeStrictness;
import com.questrail.tao.protocol.query.ResponseLine;
import com.questrail.tao.transport.FakeEngineTransport;
import com.questrail.tao.transport.TransportClosedException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behavioral tests for {@link TaoSession} over a scripted transport.
 */
final class TaoSessionTest
{
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final FakeEngineTransport transport = new FakeEngineTransport();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualWallClock clock = new ManualWallClock(T0);

    private TaoSession open(DecodeStrictness strictness) {
        return TaoSession.open(transport, TaoSessionConfig.builder()
                .withInitArgs("-lat", "ring.bmad", "-noplot")
                .withStrictness(strictness)
                .withObservabilitySink(sink)
                .withWallClock(clock)
                .build());
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void openHandsInitArgsToTheEngine()
    {
        open(DecodeStrictness.STRICT);

        assertEquals("-lat ring.bmad -noplot", transport.initArgs());
        assertEquals("setInitArgs", transport.calls().get(0).operation());
    }

    @Test
    void closeClosesTheTransport()
    {
        TaoSession tao = open(DecodeStrictness.STRICT);

        tao.close();

        assertTrue(transport.isClosed());
        assertThrows(TransportClosedException.class, () -> tao.command("show", "version"));
    }

    // ---------------------------------------------------------------------
    // Raw commands
    // ---------------------------------------------------------------------

    @Test
    void commandJoinsArgumentsAndSendsOnce()
    {
        TaoSession tao = open(DecodeStrictness.STRICT);
        transport.clear();

        tao.command("set", "ele", "q1", "k1", "=", 0.5);

        assertEquals(List.of(new FakeEngineTransport.Call("send", "set ele q1 k1 = 5.00000000000000e-01")),
                transport.calls());
        assertTrue(sink.hasEventOfType(CommandEvent.class));
    }

    @Test
    void captureReturnsPrintedOutput()
    {
        transport.printOn("show top10", "top ten\n");
        TaoSession tao = open(DecodeStrictness.STRICT);

        assertEquals("top ten\n", tao.capture("show", "top10"));
    }

    // ---------------------------------------------------------------------
    // Structured queries
    // ---------------------------------------------------------------------

    @Test
    void pythonReturnsRawLines()
    {
        transport.respondTo("python -noprint lat_list", "1;a", "2;b");
        TaoSession tao = open(DecodeStrictness.STRICT);

        List<ResponseLine> lines = tao.python("lat_list");

        assertEquals(List.of(ResponseLine.of("1", "a"), ResponseLine.of("2", "b")), lines);
    }

    @Test
    void propertiesDecodeTypedValuesAndArrays()
    {
        transport.respondTo("python -noprint plot_list r",
                "num_curves;INT;F;2",
                "curve[1];STR;F;r11",
                "curve[2];STR;F;r12",
                "visible;LOGIC;F;T");
        TaoSession tao = open(DecodeStrictness.STRICT);

        PropertyMap<DecodedValue> map = tao.properties("plot_list", "r");

        assertEquals(List.of("curve", "visible"), new ArrayList<>(map.keySet()));
        assertEquals(2, map.array("curve").size());
        assertTrue(map.scalar("visible").asBoolean());
    }

    @Test
    void parametersKeepVaryFlags()
    {
        transport.respondTo("python -noprint ele:param q1", "k1;REAL;T;0.25", "l;REAL;F;1.0");
        TaoSession tao = open(DecodeStrictness.STRICT);

        PropertyMap<Parameter> map = tao.parameters("ele:param", "q1");

        assertTrue(map.scalar("k1").vary());
        assertFalse(map.scalar("l").vary());
    }

    @Test
    void noDataDecodesToEmptyShapes()
    {
        transport.respondTo("python -noprint nothing", "INVALID;");
        TaoSession tao = open(DecodeStrictness.STRICT);

        assertTrue(tao.properties("nothing").isEmpty());
        assertTrue(tao.list("nothing").isEmpty());
        assertEquals(0, tao.matrix("nothing").rowCount());
    }

    @Test
    void listReturnsValuesInOrder()
    {
        transport.respondTo("python -noprint var_general", "1;orbit.x", "2;orbit.y");
        TaoSession tao = open(DecodeStrictness.STRICT);

        assertEquals(List.of("orbit.x", "orbit.y"), tao.list("var_general"));
    }

    @Test
    void matrixUsesConfiguredColumnsByDefault()
    {
        transport.respondTo("python -noprint plot_line r11.g.a",
                "1;0.0;1.5",
                "2;0.5;1.7",
                "3;1.0;1.9");
        TaoSession tao = open(DecodeStrictness.STRICT);

        NumericMatrix xy = tao.matrix("plot_line", "r11.g.a");

        assertEquals(3, xy.rowCount());
        assertEquals(2, xy.columnCount());
        assertEquals(1.9, xy.get(2, 1));
    }

    @Test
    void matrixWithExplicitColumns()
    {
        transport.respondTo("python -noprint data_d_array orbit.x", "1;1.0;2.0;3.0");
        TaoSession tao = open(DecodeStrictness.STRICT);

        NumericMatrix m = tao.matrixWithColumns(3, "data_d_array", "orbit.x");

        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, m.row(0));
    }

    // ---------------------------------------------------------------------
    // Strictness
    // ---------------------------------------------------------------------

    @Test
    void strictSessionRaisesOnInconsistentArrays()
    {
        transport.respondTo("python -noprint gap", "num_xs;INT;F;2", "x[1];STR;F;a", "x[3];STR;F;b");
        TaoSession tao = open(DecodeStrictness.STRICT);

        assertThrows(ConsistencyException.class, () -> tao.properties("gap"));
        assertFalse(sink.hasEventOfType(ProtocolIssueEvent.class));
    }

    @Test
    void lenientSessionForwardsIssuesToTheSink()
    {
        transport.respondTo("python -noprint gap", "num_xs;INT;F;2", "x[1];STR;F;a", "x[3];STR;F;b");
        TaoSession tao = open(DecodeStrictness.LENIENT);

        PropertyMap<DecodedValue> map = tao.properties("gap");

        assertFalse(map.isComplete());
        List<ProtocolIssueEvent> events = sink.eventsOfType(ProtocolIssueEvent.class);
        assertEquals(1, events.size());
        assertEquals("gap", events.get(0).query());
        assertEquals(ProtocolIssue.Kind.INDEX_GAP, events.get(0).issue().kind());
        assertEquals(T0, events.get(0).timestamp());
    }

    // ---------------------------------------------------------------------
    // Working directory
    // ---------------------------------------------------------------------

    @Test
    void chdirRestoresPreviousDirectoryOnClose()
    {
        TaoSession tao = open(DecodeStrictness.STRICT);

        try (ChangeDirectory scope = tao.chdir("/lattices")) {
            assertEquals("/work", scope.previous());
            assertEquals("/lattices", transport.cwd());
        }

        assertEquals("/work", transport.cwd());
    }

    @Test
    void chdirRestoresOnlyOnce()
    {
        TaoSession tao = open(DecodeStrictness.STRICT);

        ChangeDirectory scope = tao.chdir("/lattices");
        scope.close();
        scope.close();

        assertEquals(2, transport.count("changeDirectory"));
    }
}
