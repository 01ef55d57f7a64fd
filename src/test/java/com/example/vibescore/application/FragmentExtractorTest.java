package com.example.vibescore.application;

import com.example.vibescore.domain.ChangeRecord;
import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.CommentFragment;
import com.example.vibescore.domain.ExtractedFragments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FragmentExtractorTest {
    private static final ChangeRecord CHANGE =
            new ChangeRecord(
                    "0123456789abcdef0123456789abcdef01234567",
                    "Ada",
                    "ada@example.com",
                    Instant.parse("2024-05-01T09:00:00Z"),
                    "Add invoice totals");

    private FragmentExtractor extractor;

    @BeforeEach
    void setUp() {
        SourceFileFilter filter = new SourceFileFilter();
        extractor =
                new FragmentExtractor(
                        new DiffSegmenter(filter), new LineClassifier(), new SnippetWindower(new Random(11)));
    }

    @Test
    void extractsCodeAndCommentFragmentsFromSourceFiles() {
        String diff =
                DiffFixtures.concat(
                        DiffFixtures.newFile(
                                "billing/invoice.py",
                                List.of(
                                        "from decimal import Decimal",
                                        "",
                                        "subtotal = sum(line.amount for line in lines)",
                                        "discount = subtotal * customer.discount_rate",
                                        "taxable = subtotal - discount",
                                        "# tax is computed on the discounted amount only",
                                        "tax = taxable * region.tax_rate",
                                        "total = taxable + tax",
                                        "invoice.total = total.quantize(CENT)",
                                        "invoice.save(update_fields=['total'])")),
                        DiffFixtures.newFile("docs/invoice.md", List.of("Totals are computed per invoice line.")));

        ExtractedFragments fragments = extractor.extract(CHANGE, diff, true);

        assertEquals(1, fragments.codeFragments().size());
        CodeFragment code = fragments.codeFragments().get(0);
        assertEquals("billing/invoice.py", code.filePath());
        assertEquals("Ada|ada@example.com", code.authorIdentity());
        assertEquals("0123456", code.changeId());
        assertTrue(code.selfAuthored());
        assertEquals(4, code.lines().size());

        assertEquals(1, fragments.commentFragments().size());
        CommentFragment comment = fragments.commentFragments().get(0);
        assertThat(comment.commentLines()).containsExactly("# tax is computed on the discounted amount only");
        assertThat(comment.contextLines())
                .containsExactly("discount = subtotal * customer.discount_rate", "taxable = subtotal - discount");
    }

    @Test
    void otherAuthorsFragmentsAreNotSelfAuthored() {
        String diff =
                DiffFixtures.newFile(
                        "src/Cache.java",
                        List.of(
                                "    long now = clock.millis();",
                                "    entries.removeIf(e -> e.expiresAt() < now);",
                                "    size.set(entries.size());",
                                "    evictions.increment();"));

        ExtractedFragments fragments = extractor.extract(CHANGE, diff, false);

        assertEquals(1, fragments.codeFragments().size());
        assertFalse(fragments.codeFragments().get(0).selfAuthored());
        assertTrue(fragments.commentFragments().isEmpty());
    }

    @Test
    void nonSourceDiffYieldsNothing() {
        ExtractedFragments fragments =
                extractor.extract(CHANGE, DiffFixtures.newFile("package-lock.json", List.of("{}", "\"a\": 1")), true);

        assertTrue(fragments.codeFragments().isEmpty());
        assertTrue(fragments.commentFragments().isEmpty());
    }
}
