package it.piero.remoteforms.service.implementation;

import it.piero.remoteforms.FormFixtures;
import it.piero.remoteforms.model.ExportOptions;
import it.piero.remoteforms.model.FieldSelection;
import it.piero.remoteforms.model.Form;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class FieldSelectorTest {

    private final FieldSelector selector = new FieldSelector();

    @Test
    void exportsAllFieldsInDeclarationOrderWithoutDirectives() {
        FieldSelection selection = selector.select(FormFixtures.person(), ExportOptions.none());

        assertThat(selection.fields()).containsExactly("name", "age");
        assertThat(selection.exclude()).isEmpty();
        assertThat(selection.include()).isEmpty();
        assertThat(selection.readonly()).isEmpty();
    }

    @Test
    void excludedFieldsAreLeftOut() {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().excludeField("age").build());

        assertThat(selection.fields()).containsExactly("name");
        assertThat(selection.exclude()).containsExactly("age");
    }

    @Test
    void includeAndExcludeTogetherAreBothDropped(CapturedOutput output) {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().includeField("name").excludeField("age").build());

        assertThat(selection.fields()).containsExactly("name", "age");
        assertThat(selection.include()).isEmpty();
        assertThat(selection.exclude()).isEmpty();
        assertThat(output).contains("Both included [name] and excluded [age] fields given");
    }

    @Test
    void orderingReordersFields() {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().orderBy("age").orderBy("name").build());

        assertThat(selection.fields()).containsExactly("age", "name");
    }

    @Test
    void orderingNamingOnlySomeFieldsExportsOnlyThose() {
        FieldSelection selection = selector.select(FormFixtures.profile(),
                ExportOptions.builder().orderBy("country").orderBy("name").build());

        assertThat(selection.fields()).containsExactly("country", "name");
    }

    @Test
    void duplicatedNamesInOrderingAreExportedOnce() {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().ordering(List.of("age", "name", "age")).build());

        assertThat(selection.fields()).containsExactly("age", "name");
    }

    @Test
    void orderingAndExcludeCombine() {
        FieldSelection selection = selector.select(FormFixtures.profile(),
                ExportOptions.builder()
                        .ordering(List.of("country", "age", "name"))
                        .excludeField("age")
                        .build());

        assertThat(selection.fields()).containsExactly("country", "name");
    }

    @Test
    void unknownExcludedFieldsResetTheDirective(CapturedOutput output) {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().excludeField("age").excludeField("ghost").build());

        assertThat(selection.exclude()).isEmpty();
        assertThat(selection.fields()).containsExactly("name", "age");
        assertThat(output).contains("Excluded fields [ghost] are not present in form fields");
    }

    @Test
    void unknownIncludedFieldsResetTheDirective(CapturedOutput output) {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().includeField("ghost").excludeField("age").build());

        assertThat(selection.include()).isEmpty();
        assertThat(selection.exclude()).containsExactly("age");
        assertThat(selection.fields()).containsExactly("name");
        assertThat(output).contains("Included fields [ghost] are not present in form fields");
    }

    @Test
    void unknownReadonlyFieldsResetTheDirective(CapturedOutput output) {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().readonlyField("name").readonlyField("ghost").build());

        assertThat(selection.readonly()).isEmpty();
        assertThat(output).contains("Readonly fields [ghost] are not present in form fields");
    }

    @Test
    void validReadonlyFieldsAreKept() {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().readonlyField("age").build());

        assertThat(selection.readonly()).containsExactly("age");
        assertThat(selection.fields()).containsExactly("name", "age");
    }

    @Test
    void unknownOrderedFieldsFallBackToDeclarationOrder(CapturedOutput output) {
        FieldSelection selection = selector.select(FormFixtures.person(),
                ExportOptions.builder().ordering(List.of("age", "ghost", "name")).build());

        assertThat(selection.ordering()).isEmpty();
        assertThat(selection.fields()).containsExactly("name", "age");
        assertThat(output).contains("Ordered fields [ghost] are not present in form fields");
    }

    @Test
    void validIncludeDoesNotRestrictExportedFields() {
        FieldSelection selection = selector.select(FormFixtures.profile(),
                ExportOptions.builder().includeField("name").build());

        assertThat(selection.include()).containsExactly("name");
        assertThat(selection.fields()).containsExactly("name", "age", "country");
    }

    @Test
    void explicitKeyOrderIsTheDeclarationOrder() {
        Form form = FormFixtures.profile();
        form.setKeyOrder(List.of("country", "name", "age"));

        FieldSelection selection = selector.select(form, ExportOptions.none());

        assertThat(selection.fields()).containsExactly("country", "name", "age");
    }

    @Test
    void entityFormExcludeAppliesWhenCallerGivesNone() {
        Form form = FormFixtures.profile();
        form.setMetaExclude(List.of("country"));

        FieldSelection selection = selector.select(form, ExportOptions.none());

        assertThat(selection.fields()).containsExactly("name", "age");
    }

    @Test
    void entityFormFieldsConflictWithCallerExclude(CapturedOutput output) {
        Form form = FormFixtures.profile();
        form.setMetaFields(List.of("name", "age"));

        FieldSelection selection = selector.select(form, ExportOptions.builder().excludeField("country").build());

        assertThat(selection.fields()).containsExactly("name", "age", "country");
        assertThat(output).contains("ignoring both");
    }

    @Test
    void resolvedFieldsAreUniqueKnownAndNeverExcluded() {
        Form form = FormFixtures.profile();
        FieldSelection selection = selector.select(form, ExportOptions.builder()
                .ordering(List.of("country", "country", "age", "name"))
                .excludeField("name")
                .readonlyField("age")
                .build());

        assertThat(selection.fields()).doesNotHaveDuplicates();
        assertThat(form.getFields().keySet()).containsAll(selection.fields());
        assertThat(selection.fields()).doesNotContainAnyElementsOf(selection.exclude());
        assertThat(form.getFields().keySet()).containsAll(selection.readonly());
    }

    @Test
    void nullDirectivesAreTreatedAsEmpty() {
        FieldSelection selection = selector.select(FormFixtures.person(), new ExportOptions());

        assertThat(selection.fields()).containsExactly("name", "age");
    }
}
