package org.terragraph.engine.exec;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class OperationTest {

    @Test
    void planUsesDetailedExitCodes() {
        Operation plan = Operation.of(Operation.PLAN, "-lock=false");

        assertThat(plan.isPlan()).isTrue();
        assertThat(plan.arguments()).containsExactly("plan", "-detailed-exitcode", "-input=false", "-lock=false");
        assertThat(plan.classify(0, List.of())).isEqualTo(ExitClassification.SUCCESS);
        assertThat(plan.classify(2, List.of())).isEqualTo(ExitClassification.SUCCESS_WITH_DIFF);
        assertThat(plan.classify(1, List.of())).isEqualTo(ExitClassification.FAILURE);
    }

    @Test
    void applyIsNonInteractive() {
        Operation apply = Operation.of(Operation.APPLY);

        assertThat(apply.arguments()).containsExactly("apply", "-input=false", "-auto-approve");
    }

    @Test
    void otherOperationsDetectChangesFromOutput() {
        Operation apply = Operation.of(Operation.APPLY);

        assertThat(apply.classify(0, List.of("Apply complete! Resources: 0 added, 0 changed, 0 destroyed.")))
            .isEqualTo(ExitClassification.SUCCESS);
        assertThat(apply.classify(0, List.of("Apply complete! Resources: 2 added, 0 changed, 0 destroyed.")))
            .isEqualTo(ExitClassification.SUCCESS_WITH_DIFF);
        assertThat(apply.classify(2, List.of("No changes."))).isEqualTo(ExitClassification.FAILURE);
        assertThat(ExitClassification.SUCCESS_WITH_DIFF.isSuccess()).isTrue();
        assertThat(ExitClassification.FAILURE.isSuccess()).isFalse();
    }

    @Test
    void unknownOperationPassesArgumentsThrough() {
        Operation validate = Operation.of("validate", "-json");

        assertThat(validate.isPlan()).isFalse();
        assertThat(validate.arguments()).containsExactly("validate", "-json");
    }
}
