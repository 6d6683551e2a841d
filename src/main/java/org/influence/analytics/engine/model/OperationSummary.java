package org.influence.analytics.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.influence.analytics.filter.model.FilterParameter;
import org.influence.analytics.query.catalog.OperationDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Public view of an operation descriptor, as listed by the REST adapter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationSummary {

    private String name;
    private String description;
    private String kind;
    private List<String> parameters;
    private List<String> required;
    private Integer windowDefault;
    private Integer windowMax;
    private int limitDefault;
    private int limitMax;

    public static OperationSummary of(OperationDescriptor descriptor) {
        OperationSummary summary = new OperationSummary();
        summary.name = descriptor.getId().getWireName();
        summary.description = descriptor.getDescription();
        summary.kind = descriptor.getKind().name();
        summary.parameters = wireNames(descriptor.getAccepted());
        summary.required = wireNames(descriptor.getRequired());
        if (descriptor.isWindowed()) {
            summary.windowDefault = descriptor.getWindowDefault();
            summary.windowMax = descriptor.getWindowMax();
        }
        summary.limitDefault = descriptor.getLimitDefault();
        summary.limitMax = descriptor.getLimitMax();
        return summary;
    }

    private static List<String> wireNames(Iterable<FilterParameter> parameters) {
        List<String> names = new ArrayList<>();
        for (FilterParameter parameter : parameters) {
            names.add(parameter.getWireName());
        }
        return names;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getKind() {
        return kind;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<String> getRequired() {
        return required;
    }

    public Integer getWindowDefault() {
        return windowDefault;
    }

    public Integer getWindowMax() {
        return windowMax;
    }

    public int getLimitDefault() {
        return limitDefault;
    }

    public int getLimitMax() {
        return limitMax;
    }
}
