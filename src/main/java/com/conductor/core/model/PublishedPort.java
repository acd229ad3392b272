package com.conductor.core.model;

/**
 * A host port published by a service's container.
 *
 * @param publishedPort port on the host
 * @param targetPort    port inside the container
 * @param protocol      "tcp" or "udp"
 */
public record PublishedPort(int publishedPort, int targetPort, String protocol) {

    @Override
    public String toString() {
        return publishedPort + " -> " + targetPort + "/" + protocol;
    }
}
