package utilities;

import membership.GrowthMode;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterConfigurationTest {

    @Test
    void shouldApplyDefaults() {
        FilterConfiguration config = FilterConfiguration.builder().build();
        assertThat(config.kind()).isEqualTo(FilterConfiguration.Kind.FIXED);
        assertThat(config.capacity()).isEqualTo(100);
        assertThat(config.errorRate()).isEqualTo(0.001);
        assertThat(config.growthMode()).isEqualTo(GrowthMode.SMALL_SET_GROWTH);
        assertThat(config.maxCapacity()).isEqualTo(1_000_000);
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> FilterConfiguration.builder().capacity(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Capacity");
        assertThatThrownBy(() -> FilterConfiguration.builder().errorRate(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Error rate");
        assertThatThrownBy(() -> FilterConfiguration.builder()
                .kind(FilterConfiguration.Kind.DYNAMIC).capacity(500).maxCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FilterConfiguration.builder()
                .kind(FilterConfiguration.Kind.DYNAMIC).capacity(Integer.MAX_VALUE + 1L)
                .maxCapacity(Long.MAX_VALUE).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldAcceptDynamicMaxCapacityBelowBase() {
        FilterConfiguration config = FilterConfiguration.builder()
                .kind(FilterConfiguration.Kind.DYNAMIC).capacity(500).maxCapacity(100).build();
        assertThat(config.maxCapacity()).isEqualTo(100);
        assertThat(FilterFactory.create(config).capacity()).isZero();
    }

    @Test
    void shouldIgnoreMaxCapacityForOtherKinds() {
        FilterConfiguration config = FilterConfiguration.builder().capacity(500).maxCapacity(100).build();
        assertThat(config.capacity()).isEqualTo(500);
    }

    @Test
    void shouldReadProperties() {
        Properties props = new Properties();
        props.setProperty(FilterConfiguration.KIND_PROPERTY, " scalable ");
        props.setProperty(FilterConfiguration.CAPACITY_PROPERTY, "250");
        props.setProperty(FilterConfiguration.ERROR_RATE_PROPERTY, "0.02");
        props.setProperty(FilterConfiguration.GROWTH_PROPERTY, "4");

        FilterConfiguration config = FilterConfiguration.fromProperties(props);
        assertThat(config.kind()).isEqualTo(FilterConfiguration.Kind.SCALABLE);
        assertThat(config.capacity()).isEqualTo(250);
        assertThat(config.errorRate()).isEqualTo(0.02);
        assertThat(config.growthMode()).isEqualTo(GrowthMode.LARGE_SET_GROWTH);
        assertThat(config.maxCapacity()).isEqualTo(1_000_000);
    }

    @Test
    void shouldAcceptGrowthModeByName() {
        Properties props = new Properties();
        props.setProperty(FilterConfiguration.GROWTH_PROPERTY, "large_set_growth");
        assertThat(FilterConfiguration.fromProperties(props).growthMode()).isEqualTo(GrowthMode.LARGE_SET_GROWTH);

        props.setProperty(FilterConfiguration.GROWTH_PROPERTY, "3");
        assertThatThrownBy(() -> FilterConfiguration.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectUnknownKind() {
        Properties props = new Properties();
        props.setProperty(FilterConfiguration.KIND_PROPERTY, "cuckoo");
        assertThatThrownBy(() -> FilterConfiguration.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
