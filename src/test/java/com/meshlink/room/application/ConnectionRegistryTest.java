package com.meshlink.room.application;

import com.meshlink.room.core.model.ConnectionOptions;
import com.meshlink.room.core.model.IceConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private final ConnectionOptions options = ConnectionOptions.forData(IceConfig.empty());

    private ConnectionRegistry registry;
    private FakeDataConnection c1;
    private FakeDataConnection c2;
    private FakeMediaConnection other;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        c1 = new FakeDataConnection("connId1", "P", options);
        c2 = new FakeDataConnection("connId2", "P", options);
        other = new FakeMediaConnection("connId3", "Q", options);
    }

    @Test
    void addKeepsPerPeerOrder() {
        assertThat(registry.contains("P")).isFalse();

        registry.add("P", c1);
        assertThat(registry.get("P")).containsExactly(c1);

        registry.add("P", c2);
        assertThat(registry.get("P")).containsExactly(c1, c2);
    }

    @Test
    void getReturnsExactMatchOrEmpty() {
        registry.add("P", c1);
        registry.add("Q", other);

        assertThat(registry.get("P", "connId1")).containsSame(c1);
        assertThat(registry.get("Q", "connId3")).containsSame(other);
        assertThat(registry.get("P", "connId3")).isEmpty();
        assertThat(registry.get("Q", "connId1")).isEmpty();
        assertThat(registry.get("nobody", "connId1")).isEmpty();
        assertThat(registry.get("P", null)).isEmpty();
    }

    @Test
    void removeDropsTheKeyEntirely() {
        registry.add("P", c1);
        registry.add("P", c2);

        assertThat(registry.remove("P")).containsExactly(c1, c2);

        assertThat(registry.contains("P")).isFalse();
        assertThat(registry.peerIds()).doesNotContain("P");
        assertThat(registry.get("P", "connId1")).isEmpty();
        assertThat(registry.get("P")).isEmpty();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void removeUnknownPeerReturnsEmpty() {
        assertThat(registry.remove("nobody")).isEmpty();
    }

    @Test
    void allConnectionsFollowsRegistrationOrderAcrossPeers() {
        registry.add("P", c1);
        registry.add("Q", other);
        registry.add("P", c2);

        assertThat(registry.allConnections()).containsExactly(c1, other, c2);
        assertThat(registry.size()).isEqualTo(3);

        registry.remove("Q");
        assertThat(registry.allConnections()).containsExactly(c1, c2);
    }

    @Test
    void clearEmptiesEverything() {
        registry.add("P", c1);
        registry.add("Q", other);

        registry.clear();

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.allConnections()).isEmpty();
        assertThat(registry.size()).isZero();
    }
}
