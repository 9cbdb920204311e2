package com.resumevault.service;

import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import com.resumevault.repository.TagRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TagResolverImplTest {

    @Mock
    private TagRepository tagRepository;

    @InjectMocks
    private TagResolverImpl tagResolver;

    @Test
    @DisplayName("Company names are upserted in canonical form")
    void resolvesCanonicalCompany() {
        Tag google = new Tag(UUID.randomUUID(), TagKind.COMPANY, "Google");
        when(tagRepository.upsert(TagKind.COMPANY, "Google")).thenReturn(google);

        assertThat(tagResolver.resolve(TagKind.COMPANY, "  GOOGLE ")).isEqualTo(google);
        verify(tagRepository).upsert(TagKind.COMPANY, "Google");
    }

    @Test
    @DisplayName("Blank names are rejected")
    void rejectsBlank() {
        assertThatThrownBy(() -> tagResolver.resolve(TagKind.KEYWORD, "   "))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(tagRepository);
    }

    @Test
    @DisplayName("Best-effort resolution skips names that fail")
    void bestEffortSkipsFailures() {
        Tag java = new Tag(UUID.randomUUID(), TagKind.KEYWORD, "Java");
        Tag go = new Tag(UUID.randomUUID(), TagKind.KEYWORD, "Go");
        when(tagRepository.upsert(TagKind.KEYWORD, "Java")).thenReturn(java);
        when(tagRepository.upsert(TagKind.KEYWORD, "Rust")).thenThrow(new QueryTimeoutException("timeout"));
        when(tagRepository.upsert(TagKind.KEYWORD, "Go")).thenReturn(go);

        List<Tag> resolved = tagResolver.resolveBestEffort(TagKind.KEYWORD, List.of("Java", "Rust", "Go"), "cv.pdf");

        assertThat(resolved).containsExactly(java, go);
    }

    @Test
    @DisplayName("Strict resolution propagates the first failure")
    void strictPropagates() {
        when(tagRepository.upsert(TagKind.KEYWORD, "Rust")).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> tagResolver.resolveAll(TagKind.KEYWORD, List.of("Rust", "Go")))
            .isInstanceOf(QueryTimeoutException.class);
    }

    @Test
    @DisplayName("Matching with no fragments does not query")
    void noFragments() {
        assertThat(tagResolver.findMatching(TagKind.COMPANY, List.of())).isEmpty();
        verifyNoInteractions(tagRepository);
    }
}
