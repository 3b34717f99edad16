package com.ai.hostdesk.service;

import com.ai.hostdesk.component.ResponsePhrases;
import com.ai.hostdesk.dto.SeatingCandidate;
import com.ai.hostdesk.dto.SeatingNotice;
import com.ai.hostdesk.entity.DiningTable;
import com.ai.hostdesk.entity.WaitlistEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AllocationEngineTest {

    private static final Instant T0 = Instant.parse("2025-06-01T18:00:00Z");

    @Mock
    private WaitlistTableStore store;

    @Mock
    private MessageSender messageSender;

    private final ResponsePhrases phrases = new ResponsePhrases();
    private AllocationEngine engine;

    @BeforeEach
    void setUp() {
        when(store.locked(any())).thenAnswer(inv -> inv.<Supplier<?>>getArgument(0).get());
        when(messageSender.send(anyString(), anyString())).thenReturn(true);
        engine = new AllocationEngine(store, messageSender, phrases);
    }

    @Test
    void bestFitPrefersZeroWasteAndSeatsLargePartyAtSix() {
        List<DiningTable> free = List.of(table(1, "T1", 2), table(2, "T2", 2), table(5, "T5", 4), table(9, "T9", 6));
        WaitlistEntry two = entry(1, "p-two", 2, T0);
        WaitlistEntry five = entry(2, "p-five", 5, T0.plusSeconds(10));

        List<SeatingCandidate> ranked = engine.rankCandidates(List.of(two, five), free);

        assertThat(ranked).hasSize(2);
        assertThat(ranked.get(0).entry()).isSameAs(two);
        assertThat(ranked.get(0).table().getNumber()).isEqualTo("T1");
        assertThat(ranked.get(0).wastedSeats()).isZero();
        assertThat(ranked.get(1).entry()).isSameAs(five);
        assertThat(ranked.get(1).table().getNumber()).isEqualTo("T9");
        assertThat(ranked.get(1).wastedSeats()).isEqualTo(1);
    }

    @Test
    void equalWasteGoesToEarliestArrival() {
        List<DiningTable> free = List.of(table(1, "T1", 2));
        WaitlistEntry later = entry(7, "later", 2, T0.plusSeconds(30));
        WaitlistEntry earlier = entry(8, "earlier", 2, T0);

        List<SeatingCandidate> ranked = engine.rankCandidates(List.of(earlier, later), free);

        assertThat(ranked).extracting(c -> c.entry().getPartyId()).containsExactly("earlier", "later");
    }

    @Test
    void laterPartyWithLessWasteIsRankedFirst() {
        List<DiningTable> free = List.of(table(5, "T5", 4));
        WaitlistEntry earlyPair = entry(1, "pair", 2, T0);
        WaitlistEntry laterFour = entry(2, "four", 4, T0.plusSeconds(60));

        List<SeatingCandidate> ranked = engine.rankCandidates(List.of(earlyPair, laterFour), free);

        assertThat(ranked.get(0).entry().getPartyId()).isEqualTo("four");
        assertThat(ranked.get(0).wastedSeats()).isZero();
    }

    @Test
    void partyThatFitsNowhereIsSkipped() {
        List<DiningTable> free = List.of(table(1, "T1", 2));

        List<SeatingCandidate> ranked = engine.rankCandidates(List.of(entry(1, "big", 4, T0)), free);

        assertThat(ranked).isEmpty();
    }

    @Test
    void emptyWaitlistOrNoFreeTablesCommitsNothing() {
        when(store.listWaiting()).thenReturn(List.of());
        when(store.listFree()).thenReturn(List.of(table(1, "T1", 2)));

        assertThat(engine.allocate()).isEmpty();

        when(store.listWaiting()).thenReturn(List.of(entry(1, "p", 2, T0)));
        when(store.listFree()).thenReturn(List.of());

        assertThat(engine.allocate()).isEmpty();
        verify(store, never()).seat(anyLong(), anyLong());
        verify(messageSender, never()).send(anyString(), anyString());
    }

    @Test
    void allocateRepeatsPassesUntilNothingCommits() {
        WaitlistEntry a = entry(1, "+1001", 2, T0);
        WaitlistEntry b = entry(2, "+1002", 4, T0.plusSeconds(5));
        DiningTable t1 = table(1, "T1", 2);
        DiningTable t5 = table(5, "T5", 4);
        when(store.listWaiting()).thenReturn(List.of(a, b), List.of(b), List.of());
        when(store.listFree()).thenReturn(List.of(t1, t5), List.of(t5), List.of());
        when(store.seat(1L, 1L)).thenReturn(Optional.of(new SeatingNotice("+1001", "Ann", "T1", 0)));
        when(store.seat(2L, 5L)).thenReturn(Optional.of(new SeatingNotice("+1002", "Ben", "T5", 0)));

        List<SeatingNotice> seated = engine.allocate();

        assertThat(seated).extracting(SeatingNotice::tableNumber).containsExactly("T1", "T5");
        verify(store, times(3)).listWaiting();
        verify(messageSender).send("+1001", phrases.tableReady("Ann", "T1"));
        verify(messageSender).send("+1002", phrases.tableReady("Ben", "T5"));
    }

    @Test
    void passCommitsOnlyTheFirstSeat() {
        WaitlistEntry a = entry(1, "+1001", 2, T0);
        WaitlistEntry b = entry(2, "+1002", 2, T0.plusSeconds(5));
        when(store.listWaiting()).thenReturn(List.of(a, b));
        when(store.listFree()).thenReturn(List.of(table(1, "T1", 2), table(2, "T2", 2)));
        when(store.seat(1L, 1L)).thenReturn(Optional.of(new SeatingNotice("+1001", "Ann", "T1", 0)));

        Optional<SeatingNotice> notice = engine.runPass();

        assertThat(notice).map(SeatingNotice::partyId).contains("+1001");
        verify(store, times(1)).seat(anyLong(), anyLong());
    }

    @Test
    void rejectedSeatFallsThroughToNextUnclaimedCandidate() {
        WaitlistEntry a = entry(1, "+1001", 2, T0);
        WaitlistEntry b = entry(2, "+1002", 4, T0.plusSeconds(5));
        when(store.listWaiting()).thenReturn(List.of(a, b));
        when(store.listFree()).thenReturn(List.of(table(1, "T1", 2), table(5, "T5", 4)));
        when(store.seat(1L, 1L)).thenReturn(Optional.empty());
        when(store.seat(2L, 5L)).thenReturn(Optional.of(new SeatingNotice("+1002", "Ben", "T5", 0)));

        assertThat(engine.runPass()).map(SeatingNotice::tableNumber).contains("T5");
    }

    @Test
    void failedNotificationDoesNotStopAllocation() {
        WaitlistEntry a = entry(1, "+1001", 2, T0);
        when(store.listWaiting()).thenReturn(List.of(a), List.of());
        when(store.listFree()).thenReturn(List.of(table(1, "T1", 2)), List.of());
        when(store.seat(1L, 1L)).thenReturn(Optional.of(new SeatingNotice("+1001", "Ann", "T1", 0)));
        when(messageSender.send(anyString(), anyString())).thenReturn(false);

        assertThat(engine.allocate()).hasSize(1);
    }

    private static DiningTable table(long id, String number, int capacity) {
        return DiningTable.builder().id(id).number(number).capacity(capacity)
                .status(DiningTable.Status.FREE).statusChangedAt(T0).build();
    }

    private static WaitlistEntry entry(long id, String partyId, int size, Instant at) {
        return WaitlistEntry.builder().id(id).partyId(partyId).displayName(partyId).partySize(size).enqueuedAt(at).build();
    }
}
