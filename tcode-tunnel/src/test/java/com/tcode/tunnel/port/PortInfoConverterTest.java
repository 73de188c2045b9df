package com.tcode.tunnel.port;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortInfoConverterTest {

    private static TunnelPort port(String cluster, int number, String... labels) {
        return new TunnelPort(cluster, "tunnel-1", number, "http", List.of(labels),
                List.of("https://" + number + ".example.dev"));
    }

    @Test
    void toForwardedCopiesFieldsAndFlag() {
        ForwardedPort forwarded = PortInfoConverter.toForwarded(port("usw2", 3000), true);

        assertEquals(3000, forwarded.getPortNumber());
        assertEquals("http", forwarded.getProtocol());
        assertEquals(List.of("https://3000.example.dev"), forwarded.getUrls());
        assertTrue(forwarded.isUserPort());
    }

    @Test
    void classifyUserByLabel() {
        assertTrue(PortInfoConverter.classifyUser(port("usw2", 3000, "UserForwardedPort")));
        assertFalse(PortInfoConverter.classifyUser(port("usw2", 16634, "InternalPort")));
    }

    @Test
    void toForwardedManyMatchesOnClusterAndNumber() {
        TunnelPort user = port("usw2", 3000, "UserForwardedPort");
        TunnelPort sameNumberOtherCluster = port("euw1", 3000);
        TunnelPort management = port("usw2", 16634);

        List<ForwardedPort> result = PortInfoConverter.toForwardedMany(
                List.of(user, sameNumberOtherCluster, management), List.of(user));

        assertEquals(3, result.size());
        assertTrue(result.get(0).isUserPort());
        assertFalse(result.get(1).isUserPort());
        assertFalse(result.get(2).isUserPort());
    }

    @Test
    void partitionSplitsByLabel() {
        TunnelPort user = port("usw2", 3000, "UserForwardedPort");
        TunnelPort management = port("usw2", 16634);

        PortInformation info = PortInfoConverter.partition(List.of(user, management));

        assertEquals(List.of(user), info.userPorts());
        assertEquals(List.of(management), info.managementPorts());
        assertEquals(2, info.allPorts().size());
        assertNull(info.error());
        assertNotNull(info.timestamp());
    }

    @Test
    void bundleMarksUserPortsAcrossAllLists() {
        TunnelPort user = port("usw2", 3000, "UserForwardedPort");
        TunnelPort management = port("usw2", 16634);

        PortInfoEnvelope envelope = PortInfoConverter.bundle(List.of(user), List.of(management),
                List.of(user, management));

        assertTrue(envelope.userPorts().get(0).isUserPort());
        assertFalse(envelope.managementPorts().get(0).isUserPort());
        assertTrue(envelope.allPorts().get(0).isUserPort());
        assertFalse(envelope.allPorts().get(1).isUserPort());
        assertNotNull(envelope.timestamp());
        assertNull(envelope.error());
    }

    @Test
    void toEnvelopeKeepsTimestampAndError() {
        PortInformation info = PortInfoConverter.partition(List.of(port("usw2", 3000, "UserForwardedPort")))
                .withError("query failed");

        PortInfoEnvelope envelope = PortInfoConverter.toEnvelope(info);

        assertEquals(info.timestamp(), envelope.timestamp());
        assertEquals("query failed", envelope.error());
        assertEquals(1, envelope.userPorts().size());
    }

    @Test
    void fromMappingsProducesManagementPorts() {
        PortInformation info = PortInfoConverter.fromMappings(List.of(
                new PortMapping(12345, 16634, null, true, PortProvenance.TRACE_FALLBACK)));

        assertTrue(info.userPorts().isEmpty());
        assertEquals(1, info.managementPorts().size());
        assertEquals(16634, info.managementPorts().get(0).portNumber());
        assertTrue(info.managementPorts().get(0).hasLabel(PortInfoConverter.INTERNAL_LABEL));
    }

    @Test
    void toMappingsTagsQueriedPorts() {
        List<PortMapping> mappings = PortInfoConverter.toMappings(List.of(
                port("usw2", 3000, "UserForwardedPort"),
                port("usw2", 70000)));

        assertEquals(1, mappings.size());
        PortMapping mapping = mappings.get(0);
        assertEquals(3000, mapping.localPort());
        assertEquals(3000, mapping.remotePort());
        assertEquals("http", mapping.protocol());
        assertTrue(mapping.active());
        assertEquals(PortProvenance.TUNNEL_QUERY, mapping.source());
    }

    @Test
    void portMappingRejectsOutOfRangePorts() {
        assertThrows(IllegalArgumentException.class,
                () -> new PortMapping(70000, 22, null, true, PortProvenance.TUNNEL_QUERY));
    }
}
