package com.resumevault.repository;

import com.resumevault.model.Tag;
import com.resumevault.model.TagKind;
import com.resumevault.service.TagResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcTagRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private TagRepository tagRepository;

    @Autowired
    private TagResolver tagResolver;

    @Autowired
    private JdbcClient jdbcClient;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        jdbcClient.sql("TRUNCATE resume_companies, resume_keywords, resumes, companies, keywords CASCADE").update();
    }

    @Test
    @DisplayName("Case variants of a company resolve to one canonical row")
    void caseVariantsShareOneRow() {
        Tag first = tagResolver.resolve(TagKind.COMPANY, "google");
        Tag second = tagResolver.resolve(TagKind.COMPANY, "Google");
        Tag third = tagResolver.resolve(TagKind.COMPANY, " GOOGLE ");

        assertThat(first.name()).isEqualTo("Google");
        assertThat(second.id()).isEqualTo(first.id());
        assertThat(third.id()).isEqualTo(first.id());
        assertThat(tagRepository.count(TagKind.COMPANY, "Google")).isEqualTo(1);
    }

    @Test
    @DisplayName("Upsert commits independently of the caller's transaction")
    void upsertRunsInItsOwnTransaction() {
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            tagRepository.upsert(TagKind.KEYWORD, "Kotlin");
            status.setRollbackOnly();
        });

        assertThat(tagRepository.findByName(TagKind.KEYWORD, "Kotlin")).isPresent();
    }

    @Test
    @DisplayName("Concurrent resolution of the same name creates exactly one row")
    void concurrentResolveCreatesOneRow() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Tag>> tasks = IntStream.range(0, threads)
                .<Callable<Tag>>mapToObj(i -> () -> {
                    start.await();
                    return tagResolver.resolve(TagKind.COMPANY, i % 2 == 0 ? "acme corp" : "ACME CORP");
                })
                .toList();
            List<Future<Tag>> futures = tasks.stream().map(executor::submit).toList();
            start.countDown();

            Set<UUID> ids = futures.stream()
                .map(f -> {
                    try {
                        return f.get().id();
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                })
                .collect(Collectors.toSet());

            assertThat(ids).hasSize(1);
            assertThat(tagRepository.count(TagKind.COMPANY, "Acme Corp")).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Companies and keywords live in separate namespaces")
    void kindsAreSeparate() {
        Tag company = tagResolver.resolve(TagKind.COMPANY, "Go");
        Tag keyword = tagResolver.resolve(TagKind.KEYWORD, "Go");

        assertThat(company.id()).isNotEqualTo(keyword.id());
        assertThat(tagRepository.findByName(TagKind.KEYWORD, "Go")).contains(keyword);
    }

    @Test
    @DisplayName("Fragment lookup is case-insensitive and treats wildcards literally")
    void findByFragments() {
        tagResolver.resolve(TagKind.KEYWORD, "Machine Learning");
        tagResolver.resolve(TagKind.KEYWORD, "100%_Coverage");
        tagResolver.resolve(TagKind.KEYWORD, "Java");

        assertThat(tagRepository.findByNameContainingAny(TagKind.KEYWORD, List.of("learn")))
            .extracting(Tag::name)
            .containsExactly("Machine Learning");
        assertThat(tagRepository.findByNameContainingAny(TagKind.KEYWORD, List.of("%")))
            .extracting(Tag::name)
            .containsExactly("100%_Coverage");
        assertThat(tagRepository.findByNameContainingAny(TagKind.KEYWORD, List.of("jav", "learn")))
            .extracting(Tag::name)
            .containsExactly("Java", "Machine Learning");
    }
}
