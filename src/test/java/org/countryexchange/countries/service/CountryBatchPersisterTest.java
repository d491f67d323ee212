package org.countryexchange.countries.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.domain.Country;
import org.countryexchange.countries.fixture.CountryTestBuilder;
import org.countryexchange.countries.repository.CountryRepository;
import org.countryexchange.countries.service.exception.BatchPersistenceException;

/**
 * Unit tests for {@link CountryBatchPersister}.
 *
 * <p>Statement-level behavior (conflict handling, stale cycles) is covered by {@code
 * CountryRepositoryIntegrationTest} against PostgreSQL.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CountryBatchPersister Unit Tests")
class CountryBatchPersisterTest {

  @Mock private CountryRepository countryRepository;

  private CountryBatchPersister persister;

  @BeforeEach
  void setUp() {
    persister = new CountryBatchPersister(countryRepository, new CountryServiceProperties());
  }

  // ===========================================================================================
  // Chunking
  // ===========================================================================================

  @Test
  @DisplayName("persist - with empty input - no statement issued")
  void persist_WithEmptyInput_IssuesNoStatement() {
    var affected = persister.persist(List.of());

    assertThat(affected).isZero();
    verify(countryRepository, never()).upsert(anyList());
  }

  @Test
  @DisplayName("persist - with 250 countries - three chunks of 100, 100, 50 in order")
  void persist_With250Countries_ThreeChunksInOrder() {
    // Arrange
    var countries = countries(250);
    when(countryRepository.upsert(anyList())).thenReturn(100, 100, 50);

    // Act
    var affected = persister.persist(countries);

    // Assert
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Country>> captor = ArgumentCaptor.forClass(List.class);
    verify(countryRepository, times(3)).upsert(captor.capture());

    var chunks = captor.getAllValues();
    assertThat(chunks).extracting(List::size).containsExactly(100, 100, 50);
    assertThat(chunks.get(0).get(0).getName()).isEqualTo("Country 0");
    assertThat(chunks.get(1).get(0).getName()).isEqualTo("Country 100");
    assertThat(chunks.get(2).get(49).getName()).isEqualTo("Country 249");
    assertThat(affected).isEqualTo(250);
  }

  @Test
  @DisplayName("persist - with exactly one batch - single statement")
  void persist_WithExactlyOneBatch_SingleStatement() {
    when(countryRepository.upsert(anyList())).thenReturn(100);

    var affected = persister.persist(countries(100));

    verify(countryRepository, times(1)).upsert(anyList());
    assertThat(affected).isEqualTo(100);
  }

  @Test
  @DisplayName("persist - sums affected rows as reported, including updates counted twice")
  void persist_SumsReportedAffectedRows() {
    when(countryRepository.upsert(anyList())).thenReturn(180, 3);

    var affected = persister.persist(countries(150));

    assertThat(affected).isEqualTo(183);
  }

  @Test
  @DisplayName("persist - honors a configured batch size")
  void persist_HonorsConfiguredBatchSize() {
    var properties = new CountryServiceProperties();
    properties.getRefresh().setBatchSize(2);
    persister = new CountryBatchPersister(countryRepository, properties);
    when(countryRepository.upsert(anyList())).thenReturn(2, 2, 1);

    persister.persist(countries(5));

    verify(countryRepository, times(3)).upsert(anyList());
  }

  // ===========================================================================================
  // Failure policy
  // ===========================================================================================

  @Test
  @DisplayName("persist - when second chunk fails - aborts remaining chunks and reports progress")
  void persist_WhenSecondChunkFails_AbortsRemainingChunks() {
    // Arrange
    var failure = new DataIntegrityViolationException("value too long");
    when(countryRepository.upsert(anyList())).thenReturn(100).thenThrow(failure);

    // Act & Assert
    assertThatThrownBy(() -> persister.persist(countries(350)))
        .isInstanceOf(BatchPersistenceException.class)
        .hasCause(failure)
        .satisfies(
            e -> {
              var bpe = (BatchPersistenceException) e;
              assertThat(bpe.getFailedChunk()).isEqualTo(2);
              assertThat(bpe.getTotalChunks()).isEqualTo(4);
              assertThat(bpe.getAffectedBeforeFailure()).isEqualTo(100);
            });

    verify(countryRepository, times(2)).upsert(anyList());
  }

  // ===========================================================================================
  // Duplicate names
  // ===========================================================================================

  @Test
  @DisplayName("persist - with case-insensitive duplicates - last wins at the first position")
  void persist_WithDuplicateNames_LastWinsAtFirstPosition() {
    // Arrange
    var first = CountryTestBuilder.nigeria().withCapital("Lagos").build();
    var ghana = CountryTestBuilder.ghana().build();
    var last = CountryTestBuilder.nigeria().withName("NIGERIA").withCapital("Abuja").build();
    when(countryRepository.upsert(anyList())).thenReturn(2);

    // Act
    persister.persist(List.of(first, ghana, last));

    // Assert
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<Country>> captor = ArgumentCaptor.forClass(List.class);
    verify(countryRepository).upsert(captor.capture());

    assertThat(captor.getValue()).extracting(Country::getCapital).containsExactly("Abuja", "Accra");
  }

  private static List<Country> countries(int count) {
    var countries = new ArrayList<Country>(count);
    for (var i = 0; i < count; i++) {
      countries.add(CountryTestBuilder.nigeria().withName("Country " + i).build());
    }
    return countries;
  }
}
