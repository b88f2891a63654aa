package com.capacitylens.quality.workflow;

import com.capacitylens.quality.model.DataPoint;
import com.capacitylens.quality.model.StepResult;
import com.capacitylens.quality.model.Workflow;
import com.capacitylens.quality.model.WorkflowStatus;
import java.util.List;

/**
 * Outcome of running a workflow: the series after the last successful step and the
 * result of every step attempted in this run.
 */
public record WorkflowExecution(Workflow workflow, List<DataPoint> processedData, List<StepResult> stepResults) {

    public WorkflowExecution {
        processedData = List.copyOf(processedData);
        stepResults = List.copyOf(stepResults);
    }

    public boolean completed() {
        return workflow.getStatus() == WorkflowStatus.COMPLETED;
    }
}
