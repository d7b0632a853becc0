package org.quarterlang.runtime;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class InterpreterOptionsTest {

    @Test
    @Tag("unit")
    void referenceConfigurationMatchesDefaults() {
        ConfigFactory.invalidateCaches();

        assertThat(InterpreterOptions.fromConfig(ConfigFactory.load())).isEqualTo(InterpreterOptions.defaults());
        assertThat(InterpreterOptions.defaults().mode()).isEqualTo(ExecutionMode.GRAPH);
        assertThat(InterpreterOptions.defaults().maxCallDepth()).isEqualTo(1024);
    }

    @Test
    @Tag("unit")
    void readsModeAndDepthFromConfig() {
        InterpreterOptions options = InterpreterOptions.fromConfig(ConfigFactory.parseString(
                "quarterlang.interpreter { execution-mode = LINEAR, max-call-depth = 8 }"));

        assertThat(options).isEqualTo(new InterpreterOptions(ExecutionMode.LINEAR, 8));
    }

    @Test
    @Tag("unit")
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> InterpreterOptions.fromConfig(ConfigFactory.parseString(
                "quarterlang.interpreter { execution-mode = GRAPH, max-call-depth = 0 }")))
                .isInstanceOf(ConfigException.BadValue.class);
        assertThatThrownBy(() -> InterpreterOptions.fromConfig(ConfigFactory.parseString(
                "quarterlang.interpreter { execution-mode = SIDEWAYS, max-call-depth = 4 }")))
                .isInstanceOf(ConfigException.BadValue.class);
        assertThatThrownBy(() -> new InterpreterOptions(null, 4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void withModeKeepsDepth() {
        InterpreterOptions linear = new InterpreterOptions(ExecutionMode.GRAPH, 5).withMode(ExecutionMode.LINEAR);

        assertThat(linear.mode()).isEqualTo(ExecutionMode.LINEAR);
        assertThat(linear.maxCallDepth()).isEqualTo(5);
    }
}
