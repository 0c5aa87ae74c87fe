package io.github.yok.flexdataio.format.html;

import io.github.yok.flexdataio.format.FileCodec;
import io.github.yok.flexdataio.format.FileOptions;
import io.github.yok.flexdataio.util.ColumnTypeInference;
import io.github.yok.flexdataio.util.FileSupport;
import io.github.yok.flexdataio.util.TableSupport;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Reads the tables of an HTML document and writes tables as HTML using jsoup.
 *
 * <p>
 * Each matched {@code <table>} becomes one table named after its {@code id} attribute, or
 * {@code <file base name>_<index>} when it has none. Cells are the {@code th}/{@code td} children
 * of each {@code tr}; cell text is type-inferred like CSV.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
class HtmlCodec implements FileCodec<IDataSet> {

    /**
     * {@inheritDoc}
     */
    @Override
    public IDataSet decode(Path path, Map<String, Object> options) throws Exception {
        Charset charset = FileOptions.charset(options);
        Document doc = Jsoup.parse(path.toFile(), charset.name());
        Elements tables = doc.select(HtmlTableReader.SELECTOR.valueIn(options));
        String match = HtmlTableReader.MATCH.valueIn(options);
        Pattern pattern = match == null ? null : Pattern.compile(match);
        int headerRow = HtmlTableReader.HEADER_ROW.valueIn(options);
        boolean infer = HtmlTableReader.INFER_TYPES.valueIn(options);

        DefaultDataSet dataSet = new DefaultDataSet();
        Set<String> usedNames = new HashSet<>();
        int index = 0;
        for (Element table : tables) {
            if (!"table".equals(table.tagName())) {
                continue;
            }
            if (pattern != null && !pattern.matcher(table.text()).find()) {
                continue;
            }
            String name = StringUtils.defaultIfBlank(table.id(),
                    FileSupport.baseName(path) + "_" + index);
            if (!usedNames.add(name.toUpperCase())) {
                name = name + "_" + index;
                usedNames.add(name.toUpperCase());
            }
            dataSet.addTable(toTable(name, table, headerRow, infer));
            index++;
        }
        if (index == 0) {
            throw new DataSetException("No tables found matching selector '"
                    + HtmlTableReader.SELECTOR.valueIn(options) + "'"
                    + (match == null ? "" : " and pattern '" + match + "'") + " in " + path);
        }
        return dataSet;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void encode(IDataSet data, Path path, Map<String, Object> options) throws Exception {
        Charset charset = FileOptions.charset(options);
        Document doc = Document.createShell("");
        doc.charset(charset);

        List<String> classes = HtmlTableWriter.CLASSES.valueIn(options);
        Integer border = HtmlTableWriter.BORDER.valueIn(options);
        String tableId = HtmlTableWriter.TABLE_ID.valueIn(options);
        boolean header = HtmlTableWriter.HEADER.valueIn(options);
        String naRep = HtmlTableWriter.NA_REP.valueIn(options);

        for (String tableName : data.getTableNames()) {
            ITable table = data.getTable(tableName);
            Element element = doc.body().appendElement("table");
            if (border != null) {
                element.attr("border", String.valueOf(border));
            }
            element.addClass("dataframe");
            if (classes != null) {
                classes.forEach(element::addClass);
            }
            if (tableId != null) {
                element.id(tableId);
            }
            List<String> columns = TableSupport.columnNames(table);
            if (header) {
                Element tr = element.appendElement("thead").appendElement("tr");
                columns.forEach(c -> tr.appendElement("th").text(c));
            }
            Element body = element.appendElement("tbody");
            for (Object[] row : TableSupport.rows(table)) {
                Element tr = body.appendElement("tr");
                for (Object value : row) {
                    tr.appendElement("td").text(cellText(value, naRep));
                }
            }
        }
        Files.writeString(path, doc.outerHtml(), charset);
    }

    private static ITable toTable(String name, Element table, int headerRow, boolean infer)
            throws DataSetException {
        List<String[]> cells = new ArrayList<>();
        for (Element tr : table.select("tr")) {
            // Rows of nested tables belong to those tables
            if (tr.closest("table") != table) {
                continue;
            }
            List<String> row = new ArrayList<>();
            for (Element cell : tr.children()) {
                if ("th".equals(cell.tagName()) || "td".equals(cell.tagName())) {
                    row.add(cell.text());
                }
            }
            cells.add(row.toArray(new String[0]));
        }
        int width = cells.stream().mapToInt(r -> r.length).max().orElse(0);
        List<String> columns = new ArrayList<>(width);
        List<String[]> rows = cells;
        if (headerRow >= 0 && headerRow < cells.size()) {
            String[] names = cells.get(headerRow);
            for (int c = 0; c < width; c++) {
                columns.add(c < names.length && StringUtils.isNotBlank(names[c]) ? names[c]
                        : "col" + (c + 1));
            }
            rows = cells.subList(headerRow + 1, cells.size());
        } else {
            for (int c = 0; c < width; c++) {
                columns.add("col" + (c + 1));
            }
        }
        return ColumnTypeInference.toTable(name, columns, rows, infer);
    }

    private static String cellText(Object value, String naRep) {
        if (value == null) {
            return naRep;
        }
        if (value instanceof byte[]) {
            return Hex.encodeHexString((byte[]) value).toUpperCase();
        }
        return value.toString();
    }
}
