package org.example.insights.model;

public record DeliveryReport(
        int targets,
        int messagesSent,
        int sendFailures,
        int subscribersRevoked
) {
}
