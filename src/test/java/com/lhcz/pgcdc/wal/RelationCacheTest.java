package com.lhcz.pgcdc.wal;

import com.lhcz.pgcdc.error.UnknownRelationException;
import org.junit.jupiter.api.Test;

import static com.lhcz.pgcdc.support.Fixtures.USERS_V1;
import static com.lhcz.pgcdc.support.Fixtures.USERS_V2;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationCacheTest {

    @Test
    void updateReplacesDescriptorWholesale() {
        RelationCache cache = new RelationCache();
        cache.update(USERS_V1);
        cache.update(USERS_V2);

        assertThat(cache.resolve(16384)).isSameAs(USERS_V2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void clearForgetsEverything() {
        RelationCache cache = new RelationCache();
        cache.update(USERS_V1);
        cache.clear();

        assertThatThrownBy(() -> cache.resolve(16384))
                .isInstanceOf(UnknownRelationException.class)
                .satisfies(e -> assertThat(((UnknownRelationException) e).getRelationId()).isEqualTo(16384));
    }
}
