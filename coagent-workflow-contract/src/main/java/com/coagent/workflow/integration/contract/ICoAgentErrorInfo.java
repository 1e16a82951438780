package com.coagent.workflow.integration.contract;

import com.coagent.workflow.integration.enumerations.CoAgentHttpStatus;

public interface ICoAgentErrorInfo {
    String getErrorCode();
    CoAgentHttpStatus getHttpStatus();
    String getErrorTemplate();
}
