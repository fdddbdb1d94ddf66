package org.example.insights.model;

import org.example.insights.entity.RecapOptionsEntity;

import java.util.List;

/**
 * Everything fan-out needs for one run.
 *
 * @param options         the chat's stored options, null when the chat has none
 * @param subscriberIds   user ids subscribed to private delivery
 * @param replyChatId     when set, the only destination, used for on-demand recaps
 * @param requesterName   display name of whoever asked for an on-demand recap, may be null
 */
public record RecapDeliveryRequest(
        ChatInfo chat,
        int hours,
        RecapOptionsEntity options,
        List<Long> subscriberIds,
        String logId,
        String modelName,
        List<RecapBatch> batches,
        Long replyChatId,
        String requesterName
) {
    public RecapDeliveryRequest {
        subscriberIds = subscriberIds == null ? List.of() : List.copyOf(subscriberIds);
        batches = batches == null ? List.of() : List.copyOf(batches);
    }

    public static RecapDeliveryRequest scheduled(
            ChatInfo chat,
            int hours,
            RecapOptionsEntity options,
            List<Long> subscriberIds,
            String logId,
            String modelName,
            List<RecapBatch> batches) {
        return new RecapDeliveryRequest(chat, hours, options, subscriberIds, logId, modelName, batches, null, null);
    }

    public static RecapDeliveryRequest onDemand(
            ChatInfo chat,
            int hours,
            String logId,
            String modelName,
            List<RecapBatch> batches,
            long replyChatId,
            String requesterName) {
        return new RecapDeliveryRequest(chat, hours, null, List.of(), logId, modelName, batches, replyChatId, requesterName);
    }

    public boolean isOnDemand() {
        return replyChatId != null;
    }
}
