package com.pipedesk.drive.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One folder of a template as it is declared, before it is stored as a node row. Sibling order is
 * the position in the parent's children list.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TemplateNodeDefinition {

    private String name;

    private List<TemplateNodeDefinition> children = new ArrayList<>();

    public static TemplateNodeDefinition of(String name, TemplateNodeDefinition... children) {
        return new TemplateNodeDefinition(name, new ArrayList<>(Arrays.asList(children)));
    }

    public static List<TemplateNodeDefinition> flat(List<String> names) {
        List<TemplateNodeDefinition> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(of(name));
        }
        return result;
    }
}
