/* (C)2026 */
package com.ammann.metrictester.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.metrictester.dto.ArenaDTO;
import com.ammann.metrictester.dto.ArenaSamplingRequestDTO;
import com.ammann.metrictester.dto.IndividualDTO;
import com.ammann.metrictester.dto.QuadratBoundsDTO;
import com.ammann.metrictester.dto.QuadratPlacementRequestDTO;
import com.ammann.metrictester.dto.SampledCommunityDTO;
import com.ammann.metrictester.exception.InfeasibleParametersException;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.service.QuadratPlacementService;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QuadratResourceTest {

    private QuadratResource resource;

    @BeforeEach
    void setUp() {
        resource = new QuadratResource();
        resource.placementService = new QuadratPlacementService(10000, Optional.of(7L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void placesRequestedQuadrats() {
        Response response = resource.placeQuadrats(new QuadratPlacementRequestDTO(3, 300, 30));

        assertThat(response.getStatus()).isEqualTo(200);
        List<QuadratBoundsDTO> bounds = (List<QuadratBoundsDTO>) response.getEntity();
        assertThat(bounds).extracting(QuadratBoundsDTO::quadrat).containsExactly(1, 2, 3);
        bounds.forEach(b -> {
            assertThat(b.xMax() - b.xMin()).isEqualTo(30);
            assertThat(b.yMax() - b.yMin()).isEqualTo(30);
            assertThat(b.xMin()).isBetween(0, 270);
        });
    }

    @Test
    void rejectsIncompletePlacementRequest() {
        assertThatThrownBy(() -> resource.placeQuadrats(new QuadratPlacementRequestDTO(3, null, 30)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsOvercrowdedPlacement() {
        assertThatThrownBy(() -> resource.placeQuadrats(new QuadratPlacementRequestDTO(10, 100, 30)))
                .isInstanceOf(InfeasibleParametersException.class);
    }

    @Test
    void samplesArenaIntoCommunity() {
        ArenaDTO arena = new ArenaDTO(100, 100, List.of(
                new IndividualDTO("a", 10.0, 10.0),
                new IndividualDTO("b", 50.0, 50.0),
                new IndividualDTO("c", 90.0, 90.0)), List.of("a", "b", "c"));

        Response response = resource.sampleArena(new ArenaSamplingRequestDTO(arena, 2, 10));

        assertThat(response.getStatus()).isEqualTo(200);
        SampledCommunityDTO body = (SampledCommunityDTO) response.getEntity();
        assertThat(body.quadrats()).hasSize(2);
        assertThat(body.cdm().units()).hasSize(2);
        assertThat(body.regionalAbundance()).containsEntry("a", 1L).containsEntry("b", 1L).containsEntry("c", 1L);
    }

    @Test
    void rejectsSamplingWithoutArena() {
        assertThatThrownBy(() -> resource.sampleArena(new ArenaSamplingRequestDTO(null, 2, 10)))
                .isInstanceOf(ValidationException.class);
    }
}
