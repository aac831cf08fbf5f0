package com.williamcallahan.docarchive.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import java.util.ArrayList;
import java.util.List;

/**
 * A named document list filter that can be pinned to the dashboard or sidebar.
 */
@Entity
@Table(name = "saved_views")
public class SavedView {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", length = 128, nullable = false)
    private String name;

    @Column(name = "show_on_dashboard", nullable = false)
    private boolean showOnDashboard;

    @Column(name = "show_in_sidebar", nullable = false)
    private boolean showInSidebar;

    @Column(name = "sort_field", length = 128)
    private String sortField;

    @Column(name = "sort_reverse", nullable = false)
    private boolean sortReverse = false;

    @Column(name = "owner", length = 150)
    private String owner;

    @OneToMany(mappedBy = "savedView", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    private List<SavedViewFilterRule> filterRules = new ArrayList<>();

    protected SavedView() {
    }

    public SavedView(String name, boolean showOnDashboard, boolean showInSidebar) {
        this.name = name;
        this.showOnDashboard = showOnDashboard;
        this.showInSidebar = showInSidebar;
    }

    /**
     * Appends a filter rule and links it back to this view.
     */
    public SavedViewFilterRule addFilterRule(FilterRuleType ruleType, String value) {
        SavedViewFilterRule rule = new SavedViewFilterRule(this, ruleType, value);
        filterRules.add(rule);
        return rule;
    }

    public Long getId() { return id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isShowOnDashboard() { return showOnDashboard; }
    public void setShowOnDashboard(boolean showOnDashboard) { this.showOnDashboard = showOnDashboard; }

    public boolean isShowInSidebar() { return showInSidebar; }
    public void setShowInSidebar(boolean showInSidebar) { this.showInSidebar = showInSidebar; }

    public String getSortField() { return sortField; }
    public void setSortField(String sortField) { this.sortField = sortField; }

    public boolean isSortReverse() { return sortReverse; }
    public void setSortReverse(boolean sortReverse) { this.sortReverse = sortReverse; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public List<SavedViewFilterRule> getFilterRules() { return filterRules; }
}
