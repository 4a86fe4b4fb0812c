package com.routeops.api.services;

import com.routeops.api.model.RouteCreateRequest;
import com.routeops.api.model.RouteDto;
import com.routeops.api.model.RouteUpdateRequest;
import com.routeops.api.model.StatusResponse;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RouteService with a mocked RouteRepository.
 */
class RouteServiceTest {

    private static final UUID ID = UUID.fromString("0b7f5a52-3c5e-4d4b-8a0e-5d2c7f1e9a10");
    private static final OffsetDateTime DEPARTURE = OffsetDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime ARRIVAL = OffsetDateTime.of(2025, 1, 2, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime CREATED = OffsetDateTime.of(2024, 12, 31, 12, 0, 0, 0, ZoneOffset.UTC);

    private RouteRepository repository;
    private RouteService service;

    @BeforeEach
    void setUp() {
        repository = mock(RouteRepository.class);
        service = new RouteService(repository, 100);
    }

    private static RouteDto stored() {
        return new RouteDto(ID, null, "A", "B", DEPARTURE, ARRIVAL, 10, null, CREATED);
    }

    // ==========================================
    // Create
    // ==========================================

    @Test
    void testCreate_InsertsValidatedRoute() {
        when(repository.insert(any(RouteDto.class)))
            .thenAnswer(inv -> {
                RouteDto route = inv.getArgument(0);
                return Uni.createFrom().item(new RouteDto(route.id(), route.flightId(), route.origin(),
                    route.destination(), route.departureDate(), route.arrivalDate(), route.capacity(),
                    route.description(), CREATED));
            });

        RouteDto created = service.create(
                new RouteCreateRequest("A", "B", "2025-01-01T00:00Z", "2025-01-02T00:00Z", 10))
            .await().indefinitely();

        ArgumentCaptor<RouteDto> captor = ArgumentCaptor.forClass(RouteDto.class);
        verify(repository).insert(captor.capture());
        assertNotNull(captor.getValue().id());
        assertNull(captor.getValue().createdAt());

        assertEquals(captor.getValue().id(), created.id());
        assertEquals(CREATED, created.createdAt());
        assertTrue(created.departureDate().isBefore(created.arrivalDate()));
        assertTrue(created.capacity() > 0);
    }

    @Test
    void testCreate_GeneratesDistinctIds() {
        when(repository.insert(any(RouteDto.class)))
            .thenAnswer(inv -> Uni.createFrom().item((RouteDto) inv.getArgument(0)));
        RouteCreateRequest request = new RouteCreateRequest("A", "B", "2025-01-01T00:00Z", "2025-01-02T00:00Z", 10);

        UUID first = service.create(request).await().indefinitely().id();
        UUID second = service.create(request).await().indefinitely().id();

        assertNotEquals(first, second);
    }

    @Test
    void testCreate_InvalidNeverReachesRepository() {
        Uni<RouteDto> result = service.create(
            new RouteCreateRequest("A", "B", "2025-01-01T00:00Z", "2025-01-02T00:00Z", 0));

        assertThrows(RouteValidationException.class, () -> result.await().indefinitely());
        verifyNoInteractions(repository);
    }

    // ==========================================
    // Get / Delete
    // ==========================================

    @Test
    void testGet_Found() {
        when(repository.findById(ID)).thenReturn(Uni.createFrom().item(stored()));

        RouteDto route = service.get(ID.toString()).await().indefinitely();

        assertEquals(stored(), route);
    }

    @Test
    void testGet_NotFound() {
        when(repository.findById(ID)).thenReturn(Uni.createFrom().nullItem());

        RouteNotFoundException e = assertThrows(RouteNotFoundException.class,
            () -> service.get(ID.toString()).await().indefinitely());

        assertEquals(ID.toString(), e.getRouteId());
    }

    @Test
    void testGet_MalformedIdIsNotFound() {
        assertThrows(RouteNotFoundException.class,
            () -> service.get("not-a-uuid").await().indefinitely());
        verifyNoInteractions(repository);
    }

    @Test
    void testDelete_Found() {
        when(repository.deleteById(ID)).thenReturn(Uni.createFrom().item(true));

        service.delete(ID.toString()).await().indefinitely();

        verify(repository).deleteById(ID);
    }

    @Test
    void testDelete_NotFound() {
        when(repository.deleteById(ID)).thenReturn(Uni.createFrom().item(false));

        assertThrows(RouteNotFoundException.class,
            () -> service.delete(ID.toString()).await().indefinitely());
    }

    // ==========================================
    // Update
    // ==========================================

    @Test
    void testUpdate_MergesAndSaves() {
        when(repository.findById(ID)).thenReturn(Uni.createFrom().item(stored()));
        when(repository.update(any(RouteDto.class)))
            .thenAnswer(inv -> Uni.createFrom().item((RouteDto) inv.getArgument(0)));

        RouteUpdateRequest request = new RouteUpdateRequest();
        request.setDestination("C");

        RouteDto updated = service.update(ID.toString(), request).await().indefinitely();

        assertEquals("C", updated.destination());
        assertEquals("A", updated.origin());
        assertEquals(10, updated.capacity());
        assertEquals(CREATED, updated.createdAt());
    }

    @Test
    void testUpdate_InvalidMergeNotSaved() {
        when(repository.findById(ID)).thenReturn(Uni.createFrom().item(stored()));

        RouteUpdateRequest request = new RouteUpdateRequest();
        request.setArrivalDate("2024-12-31T00:00Z");

        assertThrows(RouteValidationException.class,
            () -> service.update(ID.toString(), request).await().indefinitely());
        verify(repository, never()).update(any());
    }

    @Test
    void testUpdate_UnknownRoute() {
        when(repository.findById(ID)).thenReturn(Uni.createFrom().nullItem());

        RouteUpdateRequest request = new RouteUpdateRequest();
        request.setOrigin("X");

        assertThrows(RouteNotFoundException.class,
            () -> service.update(ID.toString(), request).await().indefinitely());
        verify(repository, never()).update(any());
    }

    @Test
    void testUpdate_RowDeletedConcurrently() {
        when(repository.findById(ID)).thenReturn(Uni.createFrom().item(stored()));
        when(repository.update(any(RouteDto.class))).thenReturn(Uni.createFrom().nullItem());

        RouteUpdateRequest request = new RouteUpdateRequest();
        request.setOrigin("X");

        assertThrows(RouteNotFoundException.class,
            () -> service.update(ID.toString(), request).await().indefinitely());
    }

    // ==========================================
    // List / Count / Reset
    // ==========================================

    @Test
    void testList_Defaults() {
        when(repository.findPage(0, 100, null)).thenReturn(Uni.createFrom().item(List.of(stored())));

        List<RouteDto> routes = service.list(null, null, null).await().indefinitely();

        assertEquals(1, routes.size());
        verify(repository).findPage(0, 100, null);
    }

    @Test
    void testList_BlankFlightIgnored() {
        when(repository.findPage(anyInt(), anyInt(), isNull())).thenReturn(Uni.createFrom().item(List.of()));

        service.list("5", "10", "  ").await().indefinitely();

        verify(repository).findPage(5, 10, null);
    }

    @Test
    void testList_FlightFilterPassedThrough() {
        when(repository.findPage(anyInt(), anyInt(), eq("FL-7"))).thenReturn(Uni.createFrom().item(List.of()));

        service.list("0", "20", "FL-7").await().indefinitely();

        verify(repository).findPage(0, 20, "FL-7");
    }

    @Test
    void testList_NegativeOffset() {
        assertThrows(RouteValidationException.class,
            () -> service.list("-1", "10", null).await().indefinitely());
        verifyNoInteractions(repository);
    }

    @Test
    void testList_LimitNotAnInteger() {
        RouteValidationException e = assertThrows(RouteValidationException.class,
            () -> service.list(null, "abc", null).await().indefinitely());

        assertEquals("limit", e.getErrors().get(0).field());
        verifyNoInteractions(repository);
    }

    @Test
    void testCount() {
        when(repository.count()).thenReturn(Uni.createFrom().item(7L));

        assertEquals(7L, service.count().await().indefinitely());
    }

    @Test
    void testReset() {
        when(repository.truncate()).thenReturn(Uni.createFrom().voidItem());

        StatusResponse response = service.reset().await().indefinitely();

        assertEquals("ok", response.status());
        assertEquals("All routes were deleted", response.message());
        verify(repository).truncate();
    }
}
