package com.poststudio.test;

import com.poststudio.domain.draft.model.entity.DraftEntity;
import com.poststudio.trigger.event.DraftChangedEvent;
import com.poststudio.trigger.event.DraftEventPublisher;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

public class DraftEventPublisherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T09:05:00Z"), ZoneOffset.UTC);

    @Test
    public void shouldPublishChangeWithExternalRefs() {
        List<Object> published = new ArrayList<>();
        DraftEventPublisher publisher = new DraftEventPublisher(published::add, CLOCK);
        DraftEntity draft = DraftEntity.create("Rose Vinegar", LocalDateTime.of(2026, 3, 2, 9, 0));
        draft.setId(8L);
        draft.bindExternalRef("telegram", "chat:1/msg:42", LocalDateTime.of(2026, 3, 2, 9, 1));

        publisher.publishChanged(draft, "approve");

        Assertions.assertEquals(1, published.size());
        DraftChangedEvent event = (DraftChangedEvent) published.get(0);
        Assertions.assertEquals(8L, event.getDraftId());
        Assertions.assertEquals("approve", event.getAction());
        Assertions.assertEquals("draft", event.getStatus());
        Assertions.assertEquals("chat:1/msg:42", event.getExternalRefs().get("telegram"));
        Assertions.assertEquals(LocalDateTime.of(2026, 3, 2, 9, 5), event.getOccurredAt());
    }

    @Test
    public void shouldNotPropagateListenerFailure() {
        DraftEventPublisher publisher = new DraftEventPublisher(event -> {
            throw new IllegalStateException("listener down");
        }, CLOCK);
        DraftEntity draft = DraftEntity.create("Rose Vinegar", LocalDateTime.of(2026, 3, 2, 9, 0));
        draft.setId(8L);

        Assertions.assertDoesNotThrow(() -> publisher.publishChanged(draft, "reject"));
    }

    @Test
    public void shouldIgnoreUnsavedDraft() {
        List<Object> published = new ArrayList<>();
        DraftEventPublisher publisher = new DraftEventPublisher(published::add, CLOCK);

        publisher.publishChanged(DraftEntity.create("Rose Vinegar", LocalDateTime.of(2026, 3, 2, 9, 0)), "created");

        Assertions.assertTrue(published.isEmpty());
    }
}
