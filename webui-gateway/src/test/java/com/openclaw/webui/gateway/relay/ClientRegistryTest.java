package com.openclaw.webui.gateway.relay;

import com.openclaw.webui.gateway.protocol.ControlCodec;
import com.openclaw.webui.gateway.protocol.ControlFrames.AuthRequired;
import com.openclaw.webui.gateway.protocol.ControlFrames.Chunk;
import com.openclaw.webui.gateway.protocol.ControlFrames.Status;
import com.openclaw.webui.gateway.support.RecordingFrontendSocket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClientRegistryTest {

    private ClientRegistry registry;
    private RecordingFrontendSocket aSocket;
    private RecordingFrontendSocket bSocket;
    private RecordingFrontendSocket guestSocket;
    private FrontendConnection a;

    @BeforeEach
    void setUp() {
        registry = new ClientRegistry(new ControlCodec());
        aSocket = new RecordingFrontendSocket("a");
        bSocket = new RecordingFrontendSocket("b");
        guestSocket = new RecordingFrontendSocket("guest");
        a = new FrontendConnection(aSocket, true);
        registry.add(a);
        registry.add(new FrontendConnection(bSocket, true));
        registry.add(new FrontendConnection(guestSocket, false));
    }

    @Test
    void connectionScopedFrames_reachAllAuthenticated() {
        assertEquals(2, registry.broadcast(new Status(0, true)));
        assertEquals(List.of("status"), aSocket.types());
        assertEquals(List.of("status"), bSocket.types());
        assertTrue(guestSocket.types().isEmpty());
    }

    @Test
    void sessionScopedFrames_reachOnlyOwners() {
        a.claimSession("webui:s1");
        assertEquals(1, registry.broadcast(new Chunk(0, "webui:s1", "hi")));
        assertEquals("hi", aSocket.last().get("text").asText());
        assertTrue(bSocket.types().isEmpty());
    }

    @Test
    void failedWrite_doesNotAffectOthers() {
        aSocket.failWrites();
        assertEquals(1, registry.broadcast(new Status(1, false)));
        assertEquals(List.of("status"), bSocket.types());
    }

    @Test
    void closedSockets_areSkipped() {
        aSocket.close();
        assertEquals(1, registry.broadcast(new Status(0, true)));
    }

    @Test
    void sendTo_ignoresAuthentication() {
        FrontendConnection guest = registry.get("guest");
        assertTrue(registry.sendTo(guest, new AuthRequired()));
        assertEquals(List.of("auth_required"), guestSocket.types());
    }

    @Test
    void remove_dropsConnection() {
        assertNotNull(registry.remove("a"));
        assertEquals(2, registry.size());
        assertEquals(1, registry.authenticatedCount());
        assertNull(registry.remove("a"));
    }

    @Test
    void ownedSessions_areReadOnlyView() {
        a.claimSession("k");
        assertThrows(UnsupportedOperationException.class, () -> a.getOwnedSessions().add("other"));
        assertTrue(a.ownsSession("k"));
    }
}
