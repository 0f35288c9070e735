package im.arun.compextract.naming;

/**
 * Interaction states recognised from layer names. The page id is the index the
 * state occupies in the fixed button controller (0=up, 1=down, 2=over, 3=selectedOver);
 * states the button controller has no page for sit after it.
 */
public enum StateRole {
    NORMAL(0, "Normal"),
    DOWN(1, "Down"),
    OVER(2, "Over"),
    SELECTED(3, "Selected"),
    DISABLED(4, "Disabled");

    private final int pageId;
    private final String pageName;

    StateRole(int pageId, String pageName) {
        this.pageId = pageId;
        this.pageName = pageName;
    }

    public int getPageId() {
        return pageId;
    }

    public String getPageName() {
        return pageName;
    }
}
