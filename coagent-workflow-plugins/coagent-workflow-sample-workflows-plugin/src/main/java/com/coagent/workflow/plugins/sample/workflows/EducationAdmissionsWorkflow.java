package com.coagent.workflow.plugins.sample.workflows;

import com.coagent.workflow.core.engine.primitive.CoAgentApprovalGate;
import com.coagent.workflow.integration.enumerations.CoAgentExecutionStatus;
import com.coagent.workflow.integration.enumerations.CoAgentFieldType;
import com.coagent.workflow.integration.enumerations.CoAgentRiskLevel;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionState;
import com.coagent.workflow.integration.models.execution.CoAgentStatePatch;
import com.coagent.workflow.integration.models.node.CoAgentNodeOutcome;
import com.coagent.workflow.integration.models.node.ICoAgentNode;
import com.coagent.workflow.integration.models.workflow.CoAgentStateSchema;
import com.coagent.workflow.integration.models.workflow.CoAgentWorkflowDefinition;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Education admissions: application review, interview, assessment, admission decision and enrollment.
 *
 * <p>Applicants below the minimum academic score are rejected at review, without asking anyone.</p>
 */
public final class EducationAdmissionsWorkflow {

    public static final String NAME = "education_admissions";
    public static final double MINIMUM_ACADEMIC_SCORE = 2.5;
    public static final double ADMISSION_SCORE = 70.0;

    private static final Map<String, String> INTERVIEWERS = Map.of(
            "Computer Science", "Dr. Sarah Johnson",
            "Business Administration", "Prof. Michael Chen",
            "Engineering", "Dr. Robert Smith",
            "Nursing", "Dr. Emily Davis");

    private EducationAdmissionsWorkflow() {
    }

    public static CoAgentWorkflowDefinition create() {
        return CoAgentWorkflowDefinition.builder()
                .name(NAME)
                .description("Education admissions: review, interview, assessment, decision and enrollment")
                .schema(CoAgentStateSchema.builder()
                        .required("applicant_name", CoAgentFieldType.STRING, "Applicant full name")
                        .required("applicant_email", CoAgentFieldType.STRING, "Contact email")
                        .required("program_name", CoAgentFieldType.STRING, "Program applied for")
                        .required("application_date", CoAgentFieldType.STRING, "ISO date of application")
                        .required("academic_score", CoAgentFieldType.NUMBER, "GPA on a 4.0 scale")
                        .build())
                .entryNode("review_application")
                .node("review_application", reviewApplication())
                .node("schedule_interview", scheduleInterview())
                .node("record_interview", recordInterview())
                .node("conduct_assessment", conductAssessment())
                .node("make_admission_decision", makeAdmissionDecision())
                .node("enroll_student", enrollStudent())
                .terminalNode("workflow_completed", CoAgentExecutionStatus.COMPLETED)
                .terminalNode("workflow_rejected", CoAgentExecutionStatus.REJECTED)
                .industry("education")
                .tag("admissions")
                .estimatedSteps(6)
                .build();
    }

    private static ICoAgentNode reviewApplication() {
        return (state, context) -> context.getDocumentClient()
                .create("Student Applicant", SampleDocuments.pick(state, "applicant_name", "applicant_email", "program_name", "application_date"))
                .map(applicant -> {
                    CoAgentStatePatch.Builder patch = CoAgentStatePatch.builder()
                            .put("application_id", SampleDocuments.nameOf(applicant));
                    if (state.getNumber("academic_score", 0) < MINIMUM_ACADEMIC_SCORE) {
                        patch.put("application_status", "rejected")
                                .appendError(context.getNodeName(), "academic score below the minimum of " + MINIMUM_ACADEMIC_SCORE);
                        return CoAgentNodeOutcome.next("workflow_rejected", patch.build());
                    }
                    return CoAgentNodeOutcome.next("schedule_interview", patch.put("application_status", "under_review").build());
                });
    }

    private static CoAgentApprovalGate scheduleInterview() {
        return CoAgentApprovalGate.builder()
                .operation("schedule_interview")
                .approvedNode("record_interview")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Interview %s for %s with %s (GPA %.2f)",
                        state.getString("applicant_name"), state.getString("program_name"),
                        interviewerFor(state), state.getNumber("academic_score", 0)))
                .details(state -> {
                    Map<String, Object> details = SampleDocuments.pick(state, "application_id", "applicant_name", "program_name", "academic_score");
                    details.put("interviewer", interviewerFor(state));
                    return details;
                })
                .risk(state -> CoAgentRiskLevel.MEDIUM)
                .onApprove(state -> CoAgentStatePatch.builder().put("interviewer", interviewerFor(state)).build())
                .build();
    }

    private static ICoAgentNode recordInterview() {
        return (state, context) -> context.getDocumentClient()
                .create("Interview", SampleDocuments.pick(state, "application_id", "interviewer"))
                .map(interview -> CoAgentNodeOutcome.next("conduct_assessment", CoAgentStatePatch.builder()
                        .put("interview_id", SampleDocuments.nameOf(interview))
                        .put("application_status", "interview_scheduled")
                        .build()));
    }

    private static ICoAgentNode conductAssessment() {
        return (state, context) -> Mono.defer(() -> {
            double interviewScore = interviewScore(state.getString("applicant_name"));
            double assessmentScore = assessmentScore(state.getNumber("academic_score", 0), interviewScore);
            Map<String, Object> assessment = SampleDocuments.pick(state, "application_id");
            assessment.put("interview_score", interviewScore);
            assessment.put("assessment_score", assessmentScore);
            return context.getDocumentClient()
                    .create("Assessment Result", assessment)
                    .map(record -> CoAgentNodeOutcome.next("make_admission_decision", CoAgentStatePatch.builder()
                            .put("assessment_id", SampleDocuments.nameOf(record))
                            .put("interview_score", interviewScore)
                            .put("assessment_score", assessmentScore)
                            .put("final_score", finalScore(state.getNumber("academic_score", 0), interviewScore, assessmentScore))
                            .build()));
        });
    }

    private static CoAgentApprovalGate makeAdmissionDecision() {
        return CoAgentApprovalGate.builder()
                .operation("make_admission_decision")
                .approvedNode("enroll_student")
                .rejectedNode("workflow_rejected")
                .preview(state -> String.format("Admit %s to %s? Final score %.1f: %s",
                        state.getString("applicant_name"), state.getString("program_name"),
                        state.getNumber("final_score", 0), recommendation(state.getNumber("final_score", 0))))
                .details(state -> {
                    Map<String, Object> details = SampleDocuments.pick(state, "application_id", "academic_score",
                            "interview_score", "assessment_score", "final_score");
                    details.put("admission_recommended", state.getNumber("final_score", 0) >= ADMISSION_SCORE);
                    details.put("recommendation", recommendation(state.getNumber("final_score", 0)));
                    return details;
                })
                .risk(state -> CoAgentRiskLevel.HIGH)
                .onApprove(state -> CoAgentStatePatch.builder()
                        .put("application_status", "admitted")
                        .put("admission_recommended", state.getNumber("final_score", 0) >= ADMISSION_SCORE)
                        .build())
                .build();
    }

    private static ICoAgentNode enrollStudent() {
        return (state, context) -> context.getDocumentClient()
                .create("Program Enrollment", SampleDocuments.pick(state, "application_id", "applicant_name", "program_name"))
                .flatMap(enrollment -> context.getDocumentClient().submit("Program Enrollment", SampleDocuments.nameOf(enrollment)))
                .map(enrollment -> CoAgentNodeOutcome.next("workflow_completed", CoAgentStatePatch.builder()
                        .put("student_enrollment_id", SampleDocuments.nameOf(enrollment))
                        .put("application_status", "enrolled")
                        .build()));
    }

    // ============================================================================
    // PRIVATE HELPERS
    // ============================================================================

    private static String interviewerFor(CoAgentExecutionState state) {
        return INTERVIEWERS.getOrDefault(state.getString("program_name"), "Academic Advisor");
    }

    /**
     * Stand-in for interview feedback: stable per applicant, between 6.0 and 9.9.
     */
    static double interviewScore(String applicantName) {
        CRC32 checksum = new CRC32();
        checksum.update(applicantName.getBytes(StandardCharsets.UTF_8));
        return 6.0 + (checksum.getValue() % 40) / 10.0;
    }

    static double assessmentScore(double academicScore, double interviewScore) {
        return Math.min(100.0, (academicScore / 4.0) * 50 + (interviewScore / 10.0) * 50);
    }

    /**
     * Academic 25%, interview 30%, assessment 45%, each scaled to 0-100 first.
     */
    static double finalScore(double academicScore, double interviewScore, double assessmentScore) {
        double academic = academicScore / 4.0 * 100;
        double interview = interviewScore * 10;
        return SampleDocuments.round(academic * 0.25 + interview * 0.30 + assessmentScore * 0.45);
    }

    static String recommendation(double finalScore) {
        if (finalScore >= 85) {
            return "STRONGLY RECOMMEND";
        } else if (finalScore >= 75) {
            return "RECOMMEND";
        } else if (finalScore >= 65) {
            return "CONDITIONALLY RECOMMEND";
        } else if (finalScore >= 55) {
            return "BORDERLINE - COMMITTEE REVIEW";
        }
        return "NOT RECOMMENDED";
    }
}
