package com.scholary.mdconverter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.mdconverter.expansion.ExpansionResult;
import com.scholary.mdconverter.expansion.PatternExpander;
import com.scholary.mdconverter.job.JobStatus;
import com.scholary.mdconverter.job.JobStatusStore;
import com.scholary.mdconverter.worker.ConversionWorkerPool;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchCoordinatorTest {

  @Mock private PatternExpander expander;
  @Mock private ConversionWorkerPool pool;

  private JobStatusStore store;
  private BatchCoordinator coordinator;

  @BeforeEach
  void setUp() {
    store = new JobStatusStore();
    coordinator = new BatchCoordinator(expander, store, pool);
  }

  @Test
  void submit_shouldQueueResolvedFilesInOrder() {
    List<String> patterns = List.of("a.pdf", "a.pdf", "b.docx");
    when(expander.expand(patterns))
        .thenReturn(new ExpansionResult(List.of("/w/a.pdf", "/w/b.docx"), List.of()));

    BatchResult result = coordinator.submit(patterns);

    assertThat(result.queuedCount()).isEqualTo(2);
    assertThat(result.queuedFiles()).containsExactly("/w/a.pdf", "/w/b.docx");
    assertThat(result.unmatchedPatterns()).isEmpty();
    assertThat(store.snapshot()).containsOnlyKeys("/w/a.pdf", "/w/b.docx");

    InOrder order = inOrder(pool);
    order.verify(pool).submit("/w/a.pdf");
    order.verify(pool).submit("/w/b.docx");
  }

  @Test
  void submit_shouldReportUnmatchedPatterns() {
    when(expander.expand(anyList()))
        .thenReturn(new ExpansionResult(List.of(), List.of("missing/*.pdf")));

    BatchResult result = coordinator.submit(List.of("missing/*.pdf"));

    assertThat(result.queuedCount()).isZero();
    assertThat(result.unmatchedPatterns()).containsExactly("missing/*.pdf");
    verifyNoInteractions(pool);
  }

  @Test
  void submit_shouldSkipFilesAlreadyInFlight() {
    when(expander.expand(anyList()))
        .thenReturn(new ExpansionResult(List.of("/w/a.pdf", "/w/b.pdf"), List.of()));
    store.register("/w/a.pdf");

    BatchResult result = coordinator.submit(List.of("/w/*.pdf"));

    assertThat(result.queuedFiles()).containsExactly("/w/b.pdf");
    verify(pool, never()).submit("/w/a.pdf");
    verify(pool).submit("/w/b.pdf");
  }

  @Test
  void submit_twiceWhileQueued_shouldDispatchOnce() {
    when(expander.expand(anyList()))
        .thenReturn(new ExpansionResult(List.of("/w/a.pdf"), List.of()));

    BatchResult first = coordinator.submit(List.of("/w/a.pdf"));
    BatchResult second = coordinator.submit(List.of("/w/a.pdf"));

    assertThat(first.queuedCount()).isEqualTo(1);
    assertThat(second.queuedCount()).isZero();
    verify(pool).submit("/w/a.pdf");
  }

  @Test
  void submit_shouldRequeueCompletedFile() {
    when(expander.expand(anyList()))
        .thenReturn(new ExpansionResult(List.of("/w/a.pdf"), List.of()));
    store.register("/w/a.pdf");
    store.transition("/w/a.pdf", JobStatus.COMPLETED, "Successfully converted to: /w/a.md");

    BatchResult result = coordinator.submit(List.of("/w/a.pdf"));

    assertThat(result.queuedFiles()).containsExactly("/w/a.pdf");
    assertThat(store.get("/w/a.pdf").orElseThrow().status()).isEqualTo(JobStatus.QUEUED);
    verify(pool).submit("/w/a.pdf");
  }

  @Test
  void submit_malformedGlobShouldNotLoseOtherPatterns(@TempDir Path dir) throws IOException {
    Path pdf = Files.writeString(dir.resolve("a.pdf"), "a");
    String malformed = dir.resolve("{dr*.pdf").toString();
    BatchCoordinator realExpansion =
        new BatchCoordinator(new PatternExpander(Set.of("pdf")), store, pool);

    BatchResult result = realExpansion.submit(List.of(pdf.toString(), malformed));

    String queued = pdf.toAbsolutePath().normalize().toString();
    assertThat(result.queuedFiles()).containsExactly(queued);
    assertThat(result.unmatchedPatterns()).containsExactly(malformed);
    verify(pool).submit(queued);
  }

  @Test
  void submit_shouldRejectEmptyOrBlankInput() {
    assertThatThrownBy(() -> coordinator.submit(List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> coordinator.submit(Arrays.asList(" ", null)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> coordinator.submit(null))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(expander, pool);
  }

  @Test
  void clear_shouldEmptyStatus() {
    store.register("/w/a.pdf");

    coordinator.clear();

    assertThat(store.snapshot()).isEmpty();
  }
}
