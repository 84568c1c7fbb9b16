package org.dxworks.jovialframe.model.ast;

import java.util.ArrayList;
import java.util.List;

public abstract class Statement extends Node {
    public List<Identifier> labels = new ArrayList<>();
}
