package com.e2eq.aggregate.store;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A transport-neutral representation of a directed, typed relation between two entities,
 * as handed out by the {@link GraphStore} abstraction. Relation properties carry the
 * group key that produced an aggregate relation.
 */
public class RelationRecord {
    private String id;
    private String src;
    private String type;
    private String dst;
    private Map<String, Object> props;

    public RelationRecord() { }

    public RelationRecord(String id, String src, String type, String dst, Map<String, Object> props) {
        this.id = id;
        this.src = src;
        this.type = type;
        this.dst = dst;
        this.props = props != null ? new LinkedHashMap<>(props) : new LinkedHashMap<>();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSrc() { return src; }
    public void setSrc(String src) { this.src = src; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getDst() { return dst; }
    public void setDst(String dst) { this.dst = dst; }
    public Map<String, Object> getProps() { return props; }
    public void setProps(Map<String, Object> props) { this.props = props; }

    public Object getProperty(String key) {
        return props != null ? props.get(key) : null;
    }

    public RelationRecord copy() {
        return new RelationRecord(id, src, type, dst, props);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationRecord)) return false;
        return Objects.equals(id, ((RelationRecord) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "(" + src + ")-['" + type + "']->(" + dst + ")";
    }
}
