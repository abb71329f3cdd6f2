package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The structured map form of a scenario step, as written in YAML.
 *
 * <pre>
 *   - description: "Log in"
 *     action: click
 *     target: login button
 *     timeout: 5
 *     human_instruction: "Press the blue Log in button"
 *     automation:
 *       selector: "#login"
 *       wait_for: element_clickable
 * </pre>
 *
 * Mutable binding target for Jackson; {@link com.testweaver.parser.StepParser}
 * compiles it into an immutable {@link Step}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepSpec {

    private String description;
    private String action;
    private String target;
    private String value;
    private Integer timeout;
    @JsonProperty("human_instruction")
    private String humanInstruction;
    private AutomationSpec automation;

    public StepSpec() {}

    public StepSpec(String action, String target, String value) {
        this.action = action;
        this.target = target;
        this.value  = value;
    }

    public String getDescription()                  { return description; }
    public void setDescription(String d)            { this.description = d; }
    public String getAction()                       { return action; }
    public void setAction(String action)            { this.action = action; }
    public String getTarget()                       { return target; }
    public void setTarget(String target)            { this.target = target; }
    public String getValue()                        { return value; }
    public void setValue(String value)              { this.value = value; }
    public Integer getTimeout()                     { return timeout; }
    public void setTimeout(Integer timeout)         { this.timeout = timeout; }
    public String getHumanInstruction()             { return humanInstruction; }
    public void setHumanInstruction(String text)    { this.humanInstruction = text; }
    public AutomationSpec getAutomation()           { return automation; }
    public void setAutomation(AutomationSpec a)     { this.automation = a; }

    @Override
    public String toString() {
        return "StepSpec{action='" + action + "', target='" + target + "'" +
            (value != null ? ", value='" + value + "'" : "") + "}";
    }
}
