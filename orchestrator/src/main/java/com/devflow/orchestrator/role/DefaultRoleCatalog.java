package com.devflow.orchestrator.role;

import java.util.List;
import java.util.Map;

/**
 * The built-in role pipeline and agent profiles.
 *
 * Transitions (happy path):
 *   product-manager → architect → senior-developer → code-review → integration-engineer
 *
 * integration-engineer is terminal: finishing its steps completes the execution.
 */
public final class DefaultRoleCatalog {

    public static final String PRODUCT_MANAGER      = "product-manager";
    public static final String ARCHITECT            = "architect";
    public static final String SENIOR_DEVELOPER     = "senior-developer";
    public static final String CODE_REVIEW          = "code-review";
    public static final String INTEGRATION_ENGINEER = "integration-engineer";

    private DefaultRoleCatalog() {}

    public static List<Role> roles() {
        return List.of(
                new Role(PRODUCT_MANAGER, "Product Manager",
                        "Strategic orchestration and project management",
                        List.of("project-setup", "task-creation", "workflow-management",
                                "stakeholder-communication", "requirement-gathering"),
                        List.of("Define project scope and requirements",
                                "Create and manage task workflows",
                                "Coordinate between different roles",
                                "Ensure business value delivery"),
                        List.of("requirements-complete", "stakeholder-approval", "scope-defined"),
                        List.of(ARCHITECT),
                        List.of("Focus on business value and user requirements",
                                "Ensure clear communication with stakeholders",
                                "Define measurable success criteria",
                                "Prioritize features based on impact"),
                        List.of("Gather detailed requirements",
                                "Create user stories",
                                "Define acceptance criteria")),

                new Role(ARCHITECT, "System Architect",
                        "Technical architecture and system design",
                        List.of("system-design", "architecture-planning", "technology-selection",
                                "scalability-planning", "integration-design"),
                        List.of("Design system architecture",
                                "Select appropriate technologies",
                                "Plan integration points",
                                "Ensure scalability and maintainability"),
                        List.of("architecture-approved", "technology-stack-selected",
                                "integration-points-defined"),
                        List.of(SENIOR_DEVELOPER),
                        List.of("Design for scalability and maintainability",
                                "Consider security implications early",
                                "Plan for future extensibility",
                                "Document architectural decisions"),
                        List.of("Create system diagram",
                                "Select technology stack",
                                "Define API contracts")),

                new Role(SENIOR_DEVELOPER, "Senior Developer",
                        "High-quality code implementation and testing",
                        List.of("code-implementation", "unit-testing", "integration-testing",
                                "code-optimization", "documentation"),
                        List.of("Implement features according to architecture",
                                "Write comprehensive tests",
                                "Optimize code performance",
                                "Create technical documentation"),
                        List.of("code-complete", "tests-passing", "coverage-adequate",
                                "performance-acceptable"),
                        List.of(CODE_REVIEW),
                        List.of("Write clean, self-documenting code",
                                "Follow SOLID principles",
                                "Write comprehensive tests",
                                "Optimize for performance"),
                        List.of("Implement core features",
                                "Write unit tests",
                                "Create integration tests")),

                new Role(CODE_REVIEW, "Code Reviewer",
                        "Quality assurance and security validation",
                        List.of("code-review", "security-validation", "performance-review",
                                "quality-assessment", "approval-gating"),
                        List.of("Review code for quality and security",
                                "Validate performance requirements",
                                "Ensure coding standards compliance",
                                "Approve or request changes"),
                        List.of("security-validated", "performance-acceptable",
                                "standards-compliant", "approved-for-deployment"),
                        List.of(INTEGRATION_ENGINEER),
                        List.of("Check for security vulnerabilities",
                                "Validate code quality and standards",
                                "Ensure proper error handling",
                                "Verify test coverage"),
                        List.of("Review code quality",
                                "Check security issues",
                                "Validate performance")),

                new Role(INTEGRATION_ENGINEER, "Integration Engineer",
                        "Deployment and integration management",
                        List.of("deployment", "integration-testing", "environment-management",
                                "monitoring-setup", "delivery-preparation"),
                        List.of("Deploy code to target environments",
                                "Perform integration testing",
                                "Set up monitoring and logging",
                                "Prepare for production delivery"),
                        List.of("deployment-successful", "integration-tests-passing",
                                "monitoring-active", "production-ready"),
                        List.of(),
                        List.of("Ensure smooth deployment process",
                                "Set up proper monitoring",
                                "Validate integration points",
                                "Prepare rollback procedures"),
                        List.of("Deploy to staging",
                                "Run integration tests",
                                "Monitor system health"))
        );
    }

    public static List<AgentProfile> agentProfiles() {
        RoleOverride cursorDeveloper = new RoleOverride(
                List.of("Advanced TypeScript implementation",
                        "React component architecture",
                        "State management patterns",
                        "API integration and data fetching",
                        "Testing with Jest and React Testing Library"),
                List.of("cursor-react-component", "cursor-api-route",
                        "cursor-testing-patterns", "cursor-typescript-patterns"),
                List.of("React component with TypeScript",
                        "API service with error handling",
                        "Comprehensive test suite"),
                List.of("TypeScript strict mode",
                        "Component composition",
                        "Accessibility standards",
                        "Comprehensive testing"));

        return List.of(
                new AgentProfile("cursor",
                        List.of(PRODUCT_MANAGER, ARCHITECT, SENIOR_DEVELOPER, CODE_REVIEW),
                        List.of("code-generation", "refactoring", "debugging", "documentation", "testing"),
                        List.of("limited-deployment-capabilities", "no-direct-database-access"),
                        List.of("react-component", "api-endpoint", "utility-function"),
                        Map.of(SENIOR_DEVELOPER, cursorDeveloper)),
                new AgentProfile("copilot",
                        List.of(SENIOR_DEVELOPER, CODE_REVIEW),
                        List.of("code-completion", "suggestion-generation",
                                "pattern-recognition", "best-practices"),
                        List.of("no-workflow-management", "limited-architecture-planning"),
                        List.of("code-snippet", "function-template", "class-template"),
                        Map.of()),
                new AgentProfile("roocode",
                        List.of(ARCHITECT, SENIOR_DEVELOPER, INTEGRATION_ENGINEER),
                        List.of("workflow-automation", "deployment-management",
                                "integration-planning", "monitoring-setup"),
                        List.of("limited-code-generation", "no-quality-review"),
                        List.of("deployment-workflow", "integration-template", "monitoring-setup"),
                        Map.of()),
                new AgentProfile("kilocode",
                        List.of(PRODUCT_MANAGER, ARCHITECT, SENIOR_DEVELOPER),
                        List.of("advanced-automation", "complex-workflow-management",
                                "ai-integration", "performance-optimization"),
                        List.of("requires-high-compute", "complex-setup"),
                        List.of("ai-workflow", "performance-optimization", "complex-automation"),
                        Map.of()),
                new AgentProfile("general",
                        List.of(PRODUCT_MANAGER, ARCHITECT, SENIOR_DEVELOPER,
                                CODE_REVIEW, INTEGRATION_ENGINEER),
                        List.of(),
                        List.of(),
                        List.of(),
                        Map.of())
        );
    }
}
