package com.coagent.workflow.plugins.sample;

import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import com.coagent.workflow.integration.models.workflow.ICoAgentWorkflowProvider;
import com.coagent.workflow.plugins.sample.workflows.EducationAdmissionsWorkflow;
import com.coagent.workflow.plugins.sample.workflows.HospitalAdmissionsWorkflow;
import com.coagent.workflow.plugins.sample.workflows.HotelOrderToCashWorkflow;
import com.coagent.workflow.plugins.sample.workflows.ManufacturingProductionWorkflow;
import com.coagent.workflow.plugins.sample.workflows.RetailFulfillmentWorkflow;

import java.util.List;

/**
 * Contributes one sample workflow per supported industry.
 */
public class SampleWorkflowsProvider implements ICoAgentWorkflowProvider {

    @Override
    public String getProviderName() {
        return "coagent-sample-workflows";
    }

    @Override
    public List<CoAgentWorkflowDefinition> getWorkflowDefinitions() {
        return List.of(
                HotelOrderToCashWorkflow.create(),
                HospitalAdmissionsWorkflow.create(),
                ManufacturingProductionWorkflow.create(),
                RetailFulfillmentWorkflow.create(),
                EducationAdmissionsWorkflow.create());
    }
}
