package com.planningsync.infrastructure.scraper.ade;

import com.planningsync.domain.model.GridContainer;
import com.planningsync.domain.model.GridLayout;
import com.planningsync.domain.model.RawCell;
import com.planningsync.domain.model.ScrapeException;
import com.planningsync.domain.ports.PageAccessor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Page session on an ADE planning page.
 *
 * The grid is a {@code div.grilleData} whose inline style carries its width and
 * height. Each direct child is an event block positioned with {@code left} and
 * {@code top}; its {@code table.event} carries the block height and its
 * {@code div.eventText} the event text. Week pagination buttons are
 * {@code button.x-btn-text} labeled with the week number in parentheses and
 * link to the page rendered for that week.
 */
public class AdePlanningPage implements PageAccessor {

    private static final Logger logger = LoggerFactory.getLogger(AdePlanningPage.class);

    static final String CONTAINER_SELECTOR = "div.grilleData";
    static final String CELL_SELECTOR = "div.grilleData > div";
    static final String BLOCK_SELECTOR = "table.event";
    static final String TEXT_SELECTOR = "div.eventText";
    static final String PAGINATION_SELECTOR = "button.x-btn-text";

    /**
     * Fetches the markup of a page.
     */
    @FunctionalInterface
    public interface PageLoader {
        String load(String url) throws IOException;
    }

    private final PageLoader loader;
    private final GridLayout layout;
    private Document document;

    public AdePlanningPage(PageLoader loader, GridLayout layout, String url) throws ScrapeException {
        this.loader = loader;
        this.layout = layout;
        navigate(url);
    }

    private void navigate(String url) throws ScrapeException {
        logger.info("Navigating to {}", url);
        try {
            document = Jsoup.parse(loader.load(url), url);
            document.outputSettings().prettyPrint(false);
        } catch (IOException e) {
            throw ScrapeException.pageAccess("Failed to load " + url, e);
        }
    }

    private Document currentDocument() throws ScrapeException {
        if (document == null) {
            throw ScrapeException.pageAccess("Page session is closed", null);
        }
        return document;
    }

    @Override
    public GridContainer getContainerDimensions() throws ScrapeException {
        Element container = currentDocument().selectFirst(CONTAINER_SELECTOR);
        if (container == null) {
            throw ScrapeException.containerUnavailable("No " + CONTAINER_SELECTOR + " on the page", null);
        }

        String style = container.attr("style");
        Integer width = CssStyleParser.pixels(style, "width");
        Integer height = CssStyleParser.pixels(style, "height");
        if (width == null || height == null) {
            throw ScrapeException.containerUnavailable(
                "Grid container style has no pixel width/height: '" + style + "'", null);
        }

        try {
            return new GridContainer(width, height, layout);
        } catch (IllegalArgumentException e) {
            throw ScrapeException.containerUnavailable(e.getMessage(), e);
        }
    }

    @Override
    public void activateWeek(String label) throws ScrapeException {
        for (Element button : currentDocument().select(PAGINATION_SELECTOR)) {
            if (!button.text().contains(label)) {
                continue;
            }
            String target = resolveTarget(button);
            if (target.isEmpty()) {
                throw ScrapeException.pageAccess("Pagination control " + label + " has no target", null);
            }
            navigate(target);
            return;
        }
        throw ScrapeException.paginationNotFound(label);
    }

    private String resolveTarget(Element button) {
        Element link = button.closest("a[href]");
        if (link != null) {
            return link.absUrl("href");
        }
        return button.hasAttr("data-href") ? button.absUrl("data-href") : "";
    }

    @Override
    public List<RawCell> listEventCells() throws ScrapeException {
        List<RawCell> cells = new ArrayList<>();
        for (Element element : currentDocument().select(CELL_SELECTOR)) {
            RawCell cell = toRawCell(element);
            if (cell != null) {
                cells.add(cell);
            }
        }
        logger.debug("Found {} event cells", cells.size());
        return cells;
    }

    private RawCell toRawCell(Element element) {
        Element block = element.selectFirst(BLOCK_SELECTOR);
        Element text = element.selectFirst(TEXT_SELECTOR);
        if (block == null || text == null) {
            logger.debug("Ignoring grid child without event block: {}", element.cssSelector());
            return null;
        }

        String style = element.attr("style");
        Integer left = CssStyleParser.pixels(style, "left");
        Integer top = CssStyleParser.pixels(style, "top");
        Integer height = CssStyleParser.pixels(block.attr("style"), "height");
        if (left == null || top == null || height == null) {
            return RawCell.unreadable(text.outerHtml(), String.format(
                "no pixel left/top/height in style='%s', block style='%s'", style, block.attr("style")));
        }

        return new RawCell(left, top, height, text.outerHtml());
    }

    @Override
    public void close() {
        document = null;
    }
}
