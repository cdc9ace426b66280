package io.hearthwarrio.formweaver.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ElementFingerprintTest {

    private static ElementFingerprint tableCell(String xpath) {
        return ElementFingerprint.builder()
                .locator(Locator.xpath(xpath))
                .table(new TableContext(0, 2, "items", "Qty"))
                .build();
    }

    @Test
    void rowLocatorReplacesInnermostRowIndex() {
        ElementFingerprint fp = tableCell("//table[1]/tbody/tr[1]/td[3]/input");

        assertEquals(Locator.xpath("//table[1]/tbody/tr[4]/td[3]/input"), fp.rowLocator(3).orElseThrow());
        assertEquals(Locator.xpath("//table[1]/tbody/tr[1]/td[3]/input"), fp.rowLocator(0).orElseThrow());
    }

    @Test
    void rowLocatorIndexesPlainRowStep() {
        ElementFingerprint fp = tableCell("//table/tbody/tr/td[2]/input");

        assertEquals(Locator.xpath("//table/tbody/tr[2]/td[2]/input"), fp.rowLocator(1).orElseThrow());
    }

    @Test
    void rowLocatorFallsBackToDivRows() {
        ElementFingerprint fp = tableCell("//div[@class='grid-row']/div[2]/input");

        assertEquals(Locator.xpath("//div[@class='grid-row']/div[5]/input"), fp.rowLocator(4).orElseThrow());
    }

    @Test
    void rowLocatorEmptyWithoutXPath() {
        ElementFingerprint fp = ElementFingerprint.builder().locator(Locator.id("qty")).build();

        assertTrue(fp.rowLocator(2).isEmpty());
        assertTrue(fp.genericRowXPath().isEmpty());
    }

    @Test
    void genericRowXPathDropsRowIndex() {
        ElementFingerprint fp = tableCell("//table[1]/tbody/tr[7]/td[1]");

        assertEquals("//table[1]/tbody/tr/td[1]", fp.genericRowXPath().orElseThrow());
    }

    @Test
    void genericRowXPathKeepsPathWithoutRowIndex() {
        ElementFingerprint fp = tableCell("//form/input[2]");

        assertEquals("//form/input[2]", fp.genericRowXPath().orElseThrow());
    }

    @Test
    void stabilityScoreAddsAttributeWeightsAndCaps() {
        ElementFingerprint bare = ElementFingerprint.builder().locator(Locator.xpath("//input")).build();
        ElementFingerprint named = ElementFingerprint.builder()
                .locator(Locator.id("email"))
                .name("email")
                .label("E-mail")
                .build();
        ElementFingerprint rich = ElementFingerprint.builder()
                .locator(Locator.id("email"))
                .ariaLabel("E-mail")
                .formLabel("E-mail")
                .name("email")
                .label("E-mail")
                .classes(List.of("form-control"))
                .build();

        assertEquals(0, bare.getStabilityScore());
        assertEquals(75, named.getStabilityScore());
        assertEquals(100, rich.getStabilityScore());
    }

    @Test
    void displayNamePrefersAriaLabelThenFallsBackToTag() {
        ElementFingerprint aria = ElementFingerprint.builder().ariaLabel("Quantity").label("Qty").build();
        ElementFingerprint none = ElementFingerprint.builder().tag("textarea").build();

        assertEquals("Quantity", aria.displayName());
        assertEquals("[textarea]", none.displayName());
    }

    @Test
    void baseLabelUsesColumnHeaderBeforePlaceholder() {
        ElementFingerprint fp = ElementFingerprint.builder()
                .placeholder("enter amount")
                .table(new TableContext(0, 1, "", "Amount"))
                .build();

        assertEquals("Amount", fp.baseLabel());
    }

    @Test
    void controlKindFollowsTagAndType() {
        assertEquals(ControlKind.CHOICE, ElementFingerprint.builder().tag("select").build().controlKind());
        assertEquals(ControlKind.BOOLEAN, ElementFingerprint.builder().type("checkbox").build().controlKind());
        assertEquals(ControlKind.TEXT, ElementFingerprint.builder().type("text").build().controlKind());
        assertEquals(ControlKind.RICH_TEXT, ElementFingerprint.builder().tag("div").build().controlKind());
    }

    @Test
    void groupSizeCountsPrimaryAndSiblings() {
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(Locator.css("input.qty"))
                .build()
                .withSiblings(List.of(Locator.xpath("(//input)[2]"), Locator.xpath("(//input)[3]")));

        assertTrue(fp.isGroup());
        assertEquals(3, fp.groupSize());
    }

    @Test
    void withFrameKeepsOtherAttributes() {
        ElementFingerprint fp = ElementFingerprint.builder().locator(Locator.id("a")).label("A").build();
        ElementFingerprint framed = fp.withFrame(FrameContext.of(List.of(0, 2)));

        assertEquals("iframe[0]->iframe[2]", framed.getFrame().describe());
        assertEquals("A", framed.getLabel());
        assertEquals(fp.getLocators(), framed.getLocators());
        assertTrue(fp.getFrame().isTop());
    }

    @Test
    void duplicateLocatorsAreIgnored() {
        ElementFingerprint fp = ElementFingerprint.builder()
                .locator(Locator.id("a"))
                .locator(Locator.id("a"))
                .locator(Locator.css("#a"))
                .build();

        assertEquals(2, fp.getLocators().size());
        assertEquals(Locator.id("a"), fp.bestLocator().orElseThrow());
    }
}
