package com.questrail.tao.protocol.channel;

import com.questrail.tao.internal.time.ManualWallClock;
import com.questrail.tao.observability.CommandEvent;
import com.questrail.tao.observability.RecordingObservabilitySink;
import com.questrail.tao.observability.TaoErrorEvent;
import com.questrail.tao.transport.FakeEngineTransport;
import com.questrail.tao.transport.TransportClosedException;
import com.questrail.tao.transport.TransportCrashedException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CommandChannel}.
 */
final class CommandChannelTest
{
    private final FakeEngineTransport transport = new FakeEngineTransport();
    private final List<String> logged = new ArrayList<>();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualWallClock clock = new ManualWallClock(Instant.parse("2024-01-01T00:00:00Z"));

    private final CommandChannel channel = new CommandChannel(transport, logged::add, sink, clock);

    // ---------------------------------------------------------------------
    // command
    // ---------------------------------------------------------------------

    @Test
    void commandIssuesExactlyOneSendAndNoReads()
    {
        channel.command("use var *");

        assertEquals(List.of(new FakeEngineTransport.Call("send", "use var *")), transport.calls());
        assertEquals(0, transport.count("queryLineCount"));
        assertEquals(0, transport.count("queryLine"));
        assertEquals(0, transport.count("sendAndCapture"));
    }

    @Test
    void everyCommandIsLoggedInSendOrder()
    {
        channel.command("a");
        channel.capture("b");
        channel.command("c");

        assertEquals(List.of("a", "b", "c"), logged);
    }

    @Test
    void commandsAreAnnouncedToTheSinkWithMode()
    {
        channel.command("a");
        channel.capture("b");

        List<CommandEvent> events = sink.eventsOfType(CommandEvent.class);
        assertEquals(2, events.size());
        assertEquals(CommandEvent.Mode.COMMAND, events.get(0).mode());
        assertEquals(CommandEvent.Mode.CAPTURE, events.get(1).mode());
        assertEquals("b", events.get(1).command());
        assertEquals(clock.now(), events.get(1).timestamp());
    }

    // ---------------------------------------------------------------------
    // capture
    // ---------------------------------------------------------------------

    @Test
    void captureReturnsThePrintedOutput()
    {
        transport.printOn("show top10", "top 10 merit\n");

        assertEquals("top 10 merit\n", channel.capture("show top10"));
        assertEquals(1, transport.count("sendAndCapture"));
        assertEquals(0, transport.count("send"));
    }

    @Test
    void captureMayReturnEmptyText()
    {
        assertEquals("", channel.capture("show nothing"));
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void crashPropagatesUnchangedAndIsNotRetried()
    {
        TransportCrashedException crash = new TransportCrashedException("segfault");
        transport.failAfter(0, crash);

        TransportCrashedException thrown =
                assertThrows(TransportCrashedException.class, () -> channel.command("bad"));

        assertSame(crash, thrown);
        assertTrue(transport.calls().isEmpty());
        assertEquals(1, sink.eventsOfType(TaoErrorEvent.class).size());
        assertSame(crash, sink.eventsOfType(TaoErrorEvent.class).get(0).cause());
    }

    @Test
    void closedTransportSurfacesAsClosed()
    {
        transport.close();

        assertThrows(TransportClosedException.class, () -> channel.capture("show"));
        assertThrows(TransportClosedException.class, channel::lineCount);
    }

    @Test
    void commandIsLoggedEvenIfTheSendFails()
    {
        transport.failAfter(0, new TransportCrashedException("gone"));

        assertThrows(TransportCrashedException.class, () -> channel.command("last words"));
        assertEquals(List.of("last words"), logged);
    }
}
