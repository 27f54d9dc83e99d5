/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chunkstream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.tileverse.io.ChunkBufferPool;
import java.util.Properties;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;

class IngestConfigTest {

    private static final ChunkProcessor NO_OP = (context, chunk) -> {};

    @Test
    void builderLeavesUnsetValuesEmpty() {
        IngestConfig config = IngestConfig.builder().build();

        assertThat(config.processor()).isEmpty();
        assertThat(config.workers()).isZero();
        assertThat(config.bufferSeed()).isZero();
        assertThat(config.bufferSize()).isZero();
        assertThat(config.delimiter()).isEmpty();
        assertThat(config.noDelimiter()).isFalse();
        assertThat(config.executor()).isEmpty();
    }

    @Test
    void withDefaultsFillsWorkersAndDelimiterOnly() {
        Executor executor = Runnable::run;
        IngestConfig config = IngestConfig.builder()
                .processor(NO_OP)
                .bufferSize(128)
                .executor(executor)
                .build()
                .withDefaults();

        assertThat(config.workers()).isEqualTo(IngestConfig.DEFAULT_WORKERS);
        assertThat(config.delimiter()).contains(IngestConfig.DEFAULT_DELIMITER);
        assertThat(config.processor()).containsSame(NO_OP);
        assertThat(config.executor()).containsSame(executor);
        assertThat(config.bufferSize()).isEqualTo(128);
        assertThat(config.bufferSeed()).isZero();
    }

    @Test
    void withDefaultsKeepsExplicitValues() {
        IngestConfig config = IngestConfig.builder()
                .workers(7)
                .delimiter((byte) 0)
                .build()
                .withDefaults();

        assertThat(config.workers()).isEqualTo(7);
        assertThat(config.delimiter()).contains((byte) 0);
    }

    @Test
    void builderRejectsNegativeValues() {
        IngestConfig.Builder builder = IngestConfig.builder();

        assertThatThrownBy(() -> builder.workers(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workers cannot be negative");
        assertThatThrownBy(() -> builder.bufferSeed(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bufferSeed cannot be negative");
        assertThatThrownBy(() -> builder.bufferSize(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bufferSize cannot be negative");
        assertThatThrownBy(() -> builder.bufferSize(ChunkBufferPool.MAX_BUFFER_SIZE + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderCopiesEverything() {
        IngestConfig original = IngestConfig.builder()
                .processor(NO_OP)
                .workers(3)
                .bufferSeed(2)
                .bufferSize(4096)
                .delimiter((byte) ';')
                .noDelimiter(true)
                .build();

        IngestConfig copy = original.toBuilder().build();

        assertThat(copy.processor()).containsSame(NO_OP);
        assertThat(copy.toProperties()).isEqualTo(original.toProperties());
    }

    @Test
    void propertiesRoundTrip() {
        IngestConfig config = IngestConfig.builder()
                .workers(8)
                .bufferSeed(2)
                .bufferSize(ByteSize.MB)
                .delimiter((byte) 0x1E)
                .noDelimiter(true)
                .build();

        Properties properties = config.toProperties();
        assertEquals("8", properties.getProperty("io.tileverse.chunkstream.workers"));
        assertEquals("0x1e", properties.getProperty("io.tileverse.chunkstream.delimiter"));

        IngestConfig parsed = IngestConfig.fromProperties(properties).build();
        assertThat(parsed.toProperties()).isEqualTo(properties);
        assertThat(parsed.delimiter()).contains((byte) 0x1E);
    }

    @Test
    void toPropertiesOmitsUnsetValues() {
        assertThat(IngestConfig.builder().processor(NO_OP).build().toProperties())
                .isEmpty();
    }

    @Test
    void fromPropertiesParsesHumanReadableValues() {
        Properties properties = new Properties();
        properties.setProperty(IngestConfig.WORKERS.key(), " 16 ");
        properties.setProperty(IngestConfig.BUFFER_SIZE.key(), "1MB");
        properties.setProperty(IngestConfig.DELIMITER.key(), "\\t");
        properties.setProperty("some.other.setting", "ignored");

        IngestConfig config = IngestConfig.fromProperties(properties).processor(NO_OP).build();

        assertThat(config.workers()).isEqualTo(16);
        assertThat(config.bufferSize()).isEqualTo(1024 * 1024);
        assertThat(config.delimiter()).contains((byte) '\t');
        assertThat(config.noDelimiter()).isFalse();
    }

    @Test
    void fromPropertiesRejectsUnknownKeys() {
        Properties properties = new Properties();
        properties.setProperty(IngestParameter.KEY_PREFIX + "workerz", "4");

        assertThatThrownBy(() -> IngestConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown ingestion parameter");
    }

    @Test
    void fromPropertiesRejectsInvalidNumbers() {
        Properties properties = new Properties();
        properties.setProperty(IngestConfig.WORKERS.key(), "many");

        assertThatThrownBy(() -> IngestConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(IngestConfig.WORKERS.key())
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void parseDelimiter() {
        assertEquals((byte) ',', IngestConfig.parseDelimiter(","));
        assertEquals((byte) ' ', IngestConfig.parseDelimiter(" "));
        assertEquals((byte) '\n', IngestConfig.parseDelimiter("\\n"));
        assertEquals((byte) '\r', IngestConfig.parseDelimiter("\\r"));
        assertEquals((byte) 0, IngestConfig.parseDelimiter("\\0"));
        assertEquals((byte) 30, IngestConfig.parseDelimiter("0x1E"));
        assertEquals((byte) 44, IngestConfig.parseDelimiter("44"));
        assertEquals((byte) 0xFF, IngestConfig.parseDelimiter("255"));

        assertThatThrownBy(() -> IngestConfig.parseDelimiter("256")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IngestConfig.parseDelimiter("0x100")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IngestConfig.parseDelimiter("ab")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IngestConfig.parseDelimiter("€")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parametersShareThePrefix() {
        assertThat(IngestConfig.PARAMETERS)
                .extracting(IngestParameter::key)
                .allMatch(key -> key.startsWith(IngestParameter.KEY_PREFIX))
                .doesNotHaveDuplicates();
        assertThat(IngestConfig.WORKERS.defaultValue()).contains(IngestConfig.DEFAULT_WORKERS);
        assertThat(IngestConfig.BUFFER_SIZE.defaultValue()).isEmpty();
    }
}
