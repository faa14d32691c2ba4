package dev.scriptorium.ingestion.extraction;

import java.io.IOException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/** Extracts the text layer of a PDF with Apache PDFBox, pages separated by blank lines. */
public class PdfTextExtractor implements TextExtractor {

  @Override
  public String extract(String path, byte[] content) throws ExtractionException {
    try (PDDocument document = Loader.loadPDF(content)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      stripper.setPageEnd("\n\n");
      return stripper.getText(document);
    } catch (IOException e) {
      throw new ExtractionException("Unreadable PDF '" + path + "': " + e.getMessage(), e);
    }
  }
}
