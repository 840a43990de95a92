package com.poisearch.controller;

import com.poisearch.exception.PoiValidationException;
import com.poisearch.model.Category;
import com.poisearch.model.Position;
import com.poisearch.model.SearchCriteria;
import com.poisearch.model.param.AreaAndCategoryParam;
import com.poisearch.model.param.CreatePoiParam;
import com.poisearch.model.param.PoiIdParam;
import com.poisearch.model.result.ApiResponse;
import com.poisearch.model.result.PoiIdResult;
import com.poisearch.model.result.PoiSearchResult;
import com.poisearch.model.result.PoiSummary;
import com.poisearch.service.PoiService;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PoiControllerTest {

    @Mock
    private PoiService poiService;

    @InjectMocks
    private PoiController controller;

    @Test
    void testCreate() {
        // Given
        CreatePoiParam param = CreatePoiParam.builder()
                .name("Louvre")
                .position(Position.of(48.8606, 2.3376))
                .category(Category.MUSEUM)
                .build();
        when(poiService.create(param)).thenReturn(new PoiIdResult(3L));

        // When
        ResponseEntity<ApiResponse<PoiIdResult>> response = controller.create(param);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        assertTrue(response.getBody().getOk());
        assertEquals(3L, response.getBody().getData().getId());
        assertNotNull(response.getBody().getElapsed());
    }

    @Test
    void testDelete() {
        ResponseEntity<ApiResponse<Void>> response = controller.delete(new PoiIdParam(9L));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().getOk());
        assertNull(response.getBody().getData());
        verify(poiService).delete(9L);
    }

    @Test
    void testDeleteWithoutId() {
        PoiValidationException e = assertThrows(PoiValidationException.class,
                () -> controller.delete(new PoiIdParam(null)));

        assertEquals("idmiss", e.getCode());
        verifyNoInteractions(poiService);
    }

    @Test
    void testSearchBuildsCriteria() {
        // Given
        AreaAndCategoryParam param = AreaAndCategoryParam.builder()
                .latitudeMin(48.8)
                .latitudeMax(48.9)
                .longitudeMin(2.2)
                .longitudeMax(2.4)
                .category(Category.MUSEUM)
                .build();
        PoiSummary louvre = PoiSummary.builder().id(1L).name("Louvre").position(Position.of(48.86, 2.33)).build();
        when(poiService.search(any(SearchCriteria.class))).thenReturn(PoiSearchResult.of(List.of(louvre)));

        // When
        ResponseEntity<ApiResponse<PoiSearchResult>> response = controller.search(param);

        // Then
        ArgumentCaptor<SearchCriteria> criteria = ArgumentCaptor.forClass(SearchCriteria.class);
        verify(poiService).search(criteria.capture());
        assertEquals(Category.MUSEUM, criteria.getValue().getCategory());
        assertTrue(criteria.getValue().matches(48.86, 2.33, Category.MUSEUM));
        assertFalse(criteria.getValue().matches(48.95, 2.33, Category.MUSEUM));
        assertEquals(List.of(louvre), response.getBody().getData().getPois());
    }

    @Test
    void testSearchWithMissingBound() {
        AreaAndCategoryParam param = AreaAndCategoryParam.builder()
                .latitudeMin(48.8)
                .longitudeMin(2.2)
                .longitudeMax(2.4)
                .category(Category.MUSEUM)
                .build();

        PoiValidationException e = assertThrows(PoiValidationException.class, () -> controller.search(param));

        assertEquals("badarea", e.getCode());
        verifyNoInteractions(poiService);
    }

    @Test
    void testResetIndex() {
        when(poiService.resetIndex()).thenReturn(true);

        ResponseEntity<ApiResponse<Map<String, Boolean>>> response = controller.resetIndex();

        assertEquals(Boolean.TRUE, response.getBody().getData().get("dropped"));
        assertNotNull(response.getBody().getElapsed());
    }
}
