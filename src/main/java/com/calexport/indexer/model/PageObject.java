package com.calexport.indexer.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Page or classic Form.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class PageObject extends CodeBearingObject {
    private final Integer sourceTableId;
    private final String sourceTableView;
    private final String pageType;
    /** Root controls; nested controls hang off {@link Control#getChildren()}. */
    private final List<Control> controls;
    private final List<PageAction> actions;

    @Builder
    public PageObject(ObjectHeader header, List<Property> properties, List<Variable> variables,
                      List<Procedure> procedures, Integer sourceTableId, String sourceTableView, String pageType,
                      List<Control> controls, List<PageAction> actions) {
        super(header, properties, variables, procedures);
        this.sourceTableId = sourceTableId;
        this.sourceTableView = sourceTableView;
        this.pageType = pageType;
        this.controls = controls != null ? List.copyOf(controls) : List.of();
        this.actions = actions != null ? List.copyOf(actions) : List.of();
    }

    public Optional<Integer> sourceTableId() {
        return Optional.ofNullable(sourceTableId);
    }

    public List<Control> getAllControls() {
        return HierarchyNode.flatten(controls);
    }

    @Override
    public <R> R accept(CalObjectVisitor<R> visitor) {
        return visitor.visitPage(this);
    }
}
