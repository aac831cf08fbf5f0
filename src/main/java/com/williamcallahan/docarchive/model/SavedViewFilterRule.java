package com.williamcallahan.docarchive.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "saved_view_filter_rules")
public class SavedViewFilterRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "saved_view_id", nullable = false)
    private SavedView savedView;

    @Enumerated(EnumType.ORDINAL)
    @Column(name = "rule_type", nullable = false)
    private FilterRuleType ruleType;

    @Column(name = "rule_value", length = 255)
    private String value;

    protected SavedViewFilterRule() {
    }

    SavedViewFilterRule(SavedView savedView, FilterRuleType ruleType, String value) {
        this.savedView = savedView;
        this.ruleType = ruleType;
        this.value = value;
    }

    public Long getId() { return id; }

    public SavedView getSavedView() { return savedView; }

    public FilterRuleType getRuleType() { return ruleType; }
    public void setRuleType(FilterRuleType ruleType) { this.ruleType = ruleType; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    @Override
    public String toString() {
        return "SavedViewFilterRule: " + ruleType.code() + " : " + value;
    }
}
