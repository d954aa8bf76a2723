/* (C)2026 */
package com.ammann.metrictester.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.Arena;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ArenaDTOTest
{
    @Test
    void convertsIndividualsAndPool()
    {
        ArenaDTO dto = new ArenaDTO(50, 50,
                List.of(new IndividualDTO("a", 1.0, 2.0), new IndividualDTO("b", 10.5, 3.0)),
                List.of("a", "a", "b"));

        Arena arena = dto.toArena();

        assertThat(arena.width()).isEqualTo(50);
        assertThat(arena.individuals()).hasSize(2);
        assertThat(arena.individuals().get(1).x()).isEqualTo(10.5);
        assertThat(arena.regionalAbundance().count("a")).isEqualTo(2L);
    }

    @Test
    void emptyPoolMeansDerivedLater()
    {
        Arena arena = new ArenaDTO(20, 20, List.of(new IndividualDTO("a", 1.0, 1.0)), List.of()).toArena();

        assertThat(arena.regionalAbundance()).isNull();
    }

    @Test
    void missingDimensionsAreRejected()
    {
        assertThatThrownBy(() -> new ArenaDTO(null, 10, List.of(), null).toArena())
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("arena dimensions");
    }

    @Test
    void individualWithoutPositionIsRejected()
    {
        ArenaDTO dto = new ArenaDTO(10, 10, Arrays.asList(new IndividualDTO("a", null, 1.0)), null);

        assertThatThrownBy(dto::toArena).isInstanceOf(ValidationException.class);
    }
}
