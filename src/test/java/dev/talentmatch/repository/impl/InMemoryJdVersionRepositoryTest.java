package dev.talentmatch.repository.impl;

import dev.talentmatch.model.JdVersion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryJdVersionRepositoryTest {

    private final InMemoryJdVersionRepository repository = new InMemoryJdVersionRepository();

    private JdVersion append(String variantId) {
        return repository.append(variantId, number -> JdVersion.builder()
                .id(variantId + "-" + number)
                .companyJobVariantId(variantId)
                .version(number)
                .publishedContent("content " + number)
                .build());
    }

    @Test
    @DisplayName("Should number versions independently per variant")
    void shouldNumberPerVariant() {
        append("var-a");
        append("var-a");
        JdVersion firstOfB = append("var-b");

        assertThat(firstOfB.getVersion()).isEqualTo(1);
        assertThat(repository.findLatest("var-a")).hasValueSatisfying(v -> assertThat(v.getVersion()).isEqualTo(2));
        assertThat(repository.findLatest("var-c")).isEmpty();
    }

    @Test
    @DisplayName("Should find a single version by number")
    void shouldFindVersion() {
        append("var-a");
        append("var-a");

        assertThat(repository.findVersion("var-a", 1))
                .hasValueSatisfying(v -> assertThat(v.getPublishedContent()).isEqualTo("content 1"));
        assertThat(repository.findVersion("var-a", 3)).isEmpty();
        assertThat(repository.findVersion("var-b", 1)).isEmpty();
    }

    @Test
    @DisplayName("Should hand out distinct consecutive numbers under concurrent publishing")
    void shouldNumberConcurrently() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<JdVersion>> tasks = IntStream.range(0, 50)
                    .<Callable<JdVersion>>mapToObj(i -> () -> append("var-a"))
                    .toList();
            List<Integer> numbers = executor.invokeAll(tasks).stream()
                    .map(InMemoryJdVersionRepositoryTest::join)
                    .map(JdVersion::getVersion)
                    .toList();

            assertThat(numbers).doesNotHaveDuplicates().hasSize(50);
            assertThat(repository.findByVariant("var-a")).extracting(JdVersion::getVersion)
                    .containsExactlyElementsOf(IntStream.rangeClosed(1, 50).map(i -> 51 - i).boxed().toList());
        } finally {
            executor.shutdownNow();
        }
    }

    private static JdVersion join(Future<JdVersion> future) {
        try {
            return future.get();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
