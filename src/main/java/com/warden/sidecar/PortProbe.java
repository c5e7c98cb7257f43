package com.warden.sidecar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks whether a TCP port can be bound on this host by opening and immediately
 * closing a listening socket on the IPv4 and, where one applies, the IPv6 address.
 *
 * <p>A free answer can be stale by the time the caller acts on it; startup
 * verification catches that case.
 */
@Component
public class PortProbe {

    private static final Logger log = LoggerFactory.getLogger(PortProbe.class);

    public static final int MAX_PORT = 65535;

    /**
     * @return {@code true} when neither address family reports the port in use
     * @throws IllegalArgumentException when the port is out of range or the host is blank or unresolvable
     */
    public boolean isPortFree(int port, String host) {
        if (port < 0 || port > MAX_PORT) {
            throw new IllegalArgumentException(
                    "Invalid port number: " + port + ". Port must be between 0 and " + MAX_PORT + ".");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Host must not be blank");
        }

        InetAddress[] addresses = resolve(host);
        InetAddress ipv4 = isLoopbackName(host)
                ? InetAddress.getLoopbackAddress()
                : Arrays.stream(addresses).filter(a -> a instanceof Inet4Address).findFirst().orElse(null);

        if (ipv4 != null && !canBind(ipv4, port)) {
            return false;
        }

        Optional<InetAddress> ipv6 = ipv6Counterpart(host, addresses);
        if (ipv6.isPresent()) {
            try (var socket = new ServerSocket()) {
                socket.bind(new InetSocketAddress(ipv6.get(), port));
            } catch (IOException e) {
                // Only "in use" counts; hosts without IPv6 fail here for unrelated reasons.
                if (isAddressInUse(e)) {
                    return false;
                }
                log.trace("IPv6 probe of port {} skipped: {}", port, e.getMessage());
            }
        }
        return true;
    }

    private static boolean canBind(InetAddress address, int port) {
        try (var socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(address, port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static InetAddress[] resolve(String host) {
        try {
            return InetAddress.getAllByName(host);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("Unknown host: " + host, e);
        }
    }

    private static Optional<InetAddress> ipv6Counterpart(String host, InetAddress[] addresses) {
        if (isLoopbackName(host)) {
            try {
                return Optional.of(InetAddress.getByName("::1"));
            } catch (UnknownHostException e) {
                return Optional.empty();
            }
        }
        return Arrays.stream(addresses).filter(a -> a instanceof Inet6Address).findFirst();
    }

    private static boolean isLoopbackName(String host) {
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("localhost") || normalized.equals("127.0.0.1");
    }

    private static boolean isAddressInUse(IOException e) {
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("in use");
    }
}
