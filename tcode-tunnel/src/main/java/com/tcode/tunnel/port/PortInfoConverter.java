package com.tcode.tunnel.port;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure conversions from transport port records to the wire representation.
 */
public final class PortInfoConverter {

    /** Label the transport puts on ports the remote user forwarded explicitly. */
    public static final String USER_FORWARDED_LABEL = "UserForwardedPort";

    /** Label given to management ports reconstructed from trace lines. */
    public static final String INTERNAL_LABEL = "InternalPort";

    private PortInfoConverter() {
    }

    public static ForwardedPort toForwarded(TunnelPort port, boolean isUserPort) {
        return new ForwardedPort(
                port.portNumber(),
                port.protocol(),
                new ArrayList<>(port.portForwardingUris()),
                isUserPort);
    }

    public static boolean classifyUser(TunnelPort port) {
        return port.hasLabel(USER_FORWARDED_LABEL);
    }

    /**
     * Convert every port in {@code all}, flagging those whose cluster id and
     * port number also appear in {@code userSubset}.
     */
    public static List<ForwardedPort> toForwardedMany(List<TunnelPort> all, List<TunnelPort> userSubset) {
        Set<String> userKeys = new HashSet<>();
        for (TunnelPort port : userSubset) {
            userKeys.add(identity(port));
        }
        List<ForwardedPort> result = new ArrayList<>(all.size());
        for (TunnelPort port : all) {
            result.add(toForwarded(port, userKeys.contains(identity(port))));
        }
        return result;
    }

    /**
     * Build the outbound envelope, stamped with the current time.
     */
    public static PortInfoEnvelope bundle(List<TunnelPort> userPorts,
            List<TunnelPort> managementPorts,
            List<TunnelPort> allPorts) {
        return envelope(userPorts, managementPorts, allPorts, Instant.now().toString(), null);
    }

    /**
     * Convert a snapshot to its envelope, keeping its capture time and error.
     */
    public static PortInfoEnvelope toEnvelope(PortInformation info) {
        return envelope(info.userPorts(), info.managementPorts(), info.allPorts(), info.timestamp(), info.error());
    }

    private static PortInfoEnvelope envelope(List<TunnelPort> userPorts,
            List<TunnelPort> managementPorts,
            List<TunnelPort> allPorts,
            String timestamp,
            String error) {
        List<ForwardedPort> user = new ArrayList<>(userPorts.size());
        for (TunnelPort port : userPorts) {
            user.add(toForwarded(port, true));
        }
        List<ForwardedPort> management = new ArrayList<>(managementPorts.size());
        for (TunnelPort port : managementPorts) {
            management.add(toForwarded(port, false));
        }
        return new PortInfoEnvelope(user, management, toForwardedMany(allPorts, userPorts), timestamp, error);
    }

    /**
     * Split a raw port list into user and management ports.
     */
    public static PortInformation partition(List<TunnelPort> allPorts) {
        List<TunnelPort> user = new ArrayList<>();
        List<TunnelPort> management = new ArrayList<>();
        for (TunnelPort port : allPorts) {
            if (classifyUser(port)) {
                user.add(port);
            } else {
                management.add(port);
            }
        }
        return new PortInformation(user, management, allPorts, Instant.now().toString(), null);
    }

    /**
     * Build a snapshot from trace-derived mappings. The remote side of each
     * mapping becomes a management port; trace lines carry no user ports.
     */
    public static PortInformation fromMappings(List<PortMapping> mappings) {
        List<TunnelPort> ports = new ArrayList<>(mappings.size());
        for (PortMapping mapping : mappings) {
            ports.add(new TunnelPort(null, null, mapping.remotePort(), mapping.protocol(),
                    List.of(INTERNAL_LABEL), List.of()));
        }
        return new PortInformation(List.of(), ports, ports, Instant.now().toString(), null);
    }

    /**
     * Describe ports reported by a tunnel query as mappings. The relay
     * forwards each port under its own number, so both sides match.
     */
    public static List<PortMapping> toMappings(List<TunnelPort> ports) {
        List<PortMapping> mappings = new ArrayList<>(ports.size());
        for (TunnelPort port : ports) {
            int number = port.portNumber();
            if (number < 0 || number > PortMapping.MAX_PORT) {
                continue;
            }
            mappings.add(new PortMapping(number, number, port.protocol(), true, PortProvenance.TUNNEL_QUERY));
        }
        return mappings;
    }

    private static String identity(TunnelPort port) {
        return port.clusterId() + ":" + port.portNumber();
    }
}
