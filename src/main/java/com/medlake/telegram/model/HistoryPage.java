package com.medlake.telegram.model;

import java.util.List;

/**
 * One page of channel history. Items the source returned without a usable id or date are absent from
 * {@code messages} but still counted in {@code itemsReturned}, and paging is decided on the raw values.
 *
 * @param messages      usable messages, newest first
 * @param itemsReturned number of items the source put on the page
 * @param oldestItemId  smallest id among all returned items, or {@code null} when no item carried one
 */
public record HistoryPage(List<HistoryMessage> messages, int itemsReturned, Long oldestItemId) {

    public static HistoryPage of(List<HistoryMessage> messages) {
        Long oldest = messages.stream().map(HistoryMessage::id).min(Long::compare).orElse(null);
        return new HistoryPage(List.copyOf(messages), messages.size(), oldest);
    }

    public boolean isEmpty() {
        return itemsReturned == 0;
    }

    public int itemsUnusable() {
        return itemsReturned - messages.size();
    }
}
