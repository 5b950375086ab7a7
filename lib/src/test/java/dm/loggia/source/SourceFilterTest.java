/*
 * Copyright 2018 Davide Maestroni
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dm.loggia.source;

import org.jetbrains.annotations.NotNull;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Source filter unit tests.
 * <p>
 * Created by davide-maestroni on 04/06/2018.
 */
public class SourceFilterTest {

  private static final List<LogSource> SOURCES =
      Arrays.<LogSource>asList(NoSource.INSTANCE, new NetworkSource(), new StorageSource(),
          Sources.named("ui"));

  @Test
  public void blacklistSuppressesContainedSources() {
    final SourceFilter filter = SourceFilter.blacklist(new NetworkSource());
    assertThat(filter.getMode()).isEqualTo(FilterMode.BLACKLIST);
    assertThat(filter.isFiltered(new NetworkSource())).isTrue();
    assertThat(filter.isFiltered(new StorageSource())).isFalse();
    assertThat(filter.isFiltered(NoSource.INSTANCE)).isFalse();
  }

  @Test
  public void copyDoesNotShareSources() {
    final SourceFilter filter = SourceFilter.whitelist(new NetworkSource());
    final SourceFilter copy = filter.copy();
    assertThat(copy).isEqualTo(filter);
    copy.includeSource(new StorageSource());
    filter.excludeSource(new NetworkSource());
    assertThat(filter.getSources()).isEmpty();
    assertThat(copy.getSources()).hasSize(2);
    assertThat(copy.getMode()).isEqualTo(FilterMode.WHITELIST);
  }

  @Test
  public void emptyFilters() {
    final SourceFilter blacklist = new SourceFilter(FilterMode.BLACKLIST);
    final SourceFilter whitelist = new SourceFilter(FilterMode.WHITELIST);
    for (final LogSource source : SOURCES) {
      assertThat(blacklist.isFiltered(source)).isFalse();
      assertThat(whitelist.isFiltered(source)).isTrue();
    }
  }

  @Test
  public void equalityIgnoresInsertionOrder() {
    final SourceFilter first = SourceFilter.blacklist(new NetworkSource(), new StorageSource());
    final SourceFilter second = SourceFilter.blacklist(new StorageSource(), new NetworkSource());
    assertThat(first).isEqualTo(second);
    assertThat(first.hashCode()).isEqualTo(second.hashCode());
    assertThat(first).isNotEqualTo(
        SourceFilter.whitelist(new NetworkSource(), new StorageSource()));
    assertThat(first).isNotEqualTo(SourceFilter.blacklist(new NetworkSource()));
  }

  @Test
  public void filterCorrectness() {
    for (final SourceFilter filter : Arrays.asList(SourceFilter.blacklist(),
        SourceFilter.blacklist(new NetworkSource(), NoSource.INSTANCE),
        SourceFilter.whitelist(), SourceFilter.whitelist(new StorageSource()),
        SourceFilter.whitelist(Sources.named("ui"), NoSource.INSTANCE))) {
      for (final LogSource source : SOURCES) {
        final boolean contained = filter.getSources().contains(source);
        assertThat(filter.isFiltered(source)).isEqualTo(
            (filter.getMode() == FilterMode.BLACKLIST) == contained);
      }
    }
  }

  @Test
  public void includeAndExcludeAreDual() {
    for (final FilterMode mode : FilterMode.values()) {
      for (final LogSource source : SOURCES) {
        final SourceFilter filter = new SourceFilter(mode);
        final boolean initial = filter.isFiltered(source);
        final SourceFilter included = filter.copy();
        included.includeSource(source);
        final SourceFilter excluded = filter.copy();
        excluded.excludeSource(source);
        assertThat(included.isFiltered(source)).isFalse();
        assertThat(excluded.isFiltered(source)).isTrue();
        assertThat(included.isFiltered(source) != initial).isNotEqualTo(
            excluded.isFiltered(source) != initial);
        if (included.isFiltered(source) != initial) {
          included.excludeSource(source);
          assertThat(included.isFiltered(source)).isEqualTo(initial);

        } else {
          excluded.includeSource(source);
          assertThat(excluded.isFiltered(source)).isEqualTo(initial);
        }
      }
    }
  }

  @Test
  public void includeAndExcludeAreIdempotent() {
    for (final FilterMode mode : FilterMode.values()) {
      final SourceFilter once = new SourceFilter(mode);
      once.includeSource(new NetworkSource());
      final SourceFilter twice = new SourceFilter(mode);
      twice.includeSource(new NetworkSource());
      twice.includeSource(new NetworkSource());
      assertThat(twice).isEqualTo(once);
      once.excludeSource(new StorageSource());
      twice.excludeSource(new StorageSource());
      twice.excludeSource(new StorageSource());
      assertThat(twice).isEqualTo(once);
      assertThat(twice.getSources()).hasSameSizeAs(once.getSources());
    }
  }

  @Test
  public void noSourceMustBeExplicitlyExcluded() {
    final SourceFilter filter = SourceFilter.blacklist(new NetworkSource());
    assertThat(filter.isFiltered(Sources.noSource())).isFalse();
    filter.excludeSource(Sources.noSource());
    assertThat(filter.isFiltered(Sources.noSource())).isTrue();
  }

  @Test
  public void parameterizedSourcesAreFilteredAsOne() {
    final SourceFilter filter = SourceFilter.blacklist(Sources.named("db"));
    assertThat(filter.isFiltered(Sources.named("http"))).isTrue();
    filter.includeSource(Sources.named("http"));
    assertThat(filter.isFiltered(Sources.named("db"))).isFalse();
  }

  @Test
  public void whitelistSuppressesMissingSources() {
    final SourceFilter filter = SourceFilter.whitelist(new StorageSource());
    assertThat(filter.isFiltered(new StorageSource())).isFalse();
    assertThat(filter.isFiltered(new NetworkSource())).isTrue();
    assertThat(filter.isFiltered(NoSource.INSTANCE)).isTrue();
  }

  private static class NetworkSource extends AbstractLogSource {

    @NotNull
    public String getName() {
      return "network";
    }
  }

  private static class StorageSource extends AbstractLogSource {

    @NotNull
    public String getName() {
      return "storage";
    }
  }
}
