package dev.tokenbench.task;

import java.util.List;

/** Tasks against the bundled sample workbook (sheets Sales A1:F6 and Summary A1:B6). */
final class BuiltinTasks {
    private BuiltinTasks() {}

    static final List<TaskDefinition> STANDARD =
            List.of(
                    TaskDefinition.of(
                            "list_sheets",
                            "List Sheets",
                            "List all sheets in the workbook with basic info",
                            "List all sheets in the Excel file with their cell counts.",
                            """
                            The workbook contains 2 sheets:
                            1. Sales - Dimension A1:F6 (36 cells)
                            2. Summary - Dimension A1:B6 (12 cells)"""),
                    TaskDefinition.of(
                            "view_range",
                            "View Range",
                            "Display a range of cells as a table",
                            "Show the data in the Sales sheet from A1 to F6.",
                            """
                            Sales A1:F6 contains product sales data:
                            - Row 1: Headers (Product, Q1, Q2, Q3, Q4, Total)
                            - Row 2: Widget A with quarterly values $12,500, $14,200, $13,800, $15,600 and Total formula
                            - Row 3: Widget B with quarterly values $8,900, $9,100, $8,700, $9,500 and Total formula
                            - Row 4: Widget C with quarterly values $21,000, $19,500, $22,100, $23,400 and Total formula
                            - Row 5: Total row with SUM formulas (42400, 42800, 44600, 48500, 178300)
                            - Row 6: Average row with AVERAGE formulas"""),
                    TaskDefinition.of(
                            "statistics",
                            "Calculate Statistics",
                            "Compute statistics on a numeric range",
                            "Calculate statistics (count, sum, min, max, mean) for the quarterly"
                                    + " data in Sales B2:E4.",
                            """
                            Statistics for B2:E4 (12 quarterly values):
                            - Count: 12
                            - Sum: 178,300
                            - Min: 8,700
                            - Max: 23,400
                            - Mean/Average: ~14,858"""),
                    TaskDefinition.of(
                            "show_formulas",
                            "Show Formulas",
                            "Display formulas instead of computed values",
                            "Show the formulas in the Sales sheet column F (F2:F6).",
                            """
                            Formulas in Sales column F (F2:F6):
                            - F2: =SUM(B2:E2)
                            - F3: =SUM(B3:E3)
                            - F4: =SUM(B4:E4)
                            - F5: =SUM(F2:F4)
                            - F6: =AVERAGE(F2:F4)"""),
                    TaskDefinition.of(
                            "search",
                            "Search Content",
                            "Find cells containing a specific pattern",
                            "Search for cells containing 'Widget' in the workbook.",
                            """
                            Found 3 cells containing 'Widget':
                            - Sales!A2: Widget A
                            - Sales!A3: Widget B
                            - Sales!A4: Widget C"""),
                    TaskDefinition.of(
                            "cell_details",
                            "Cell Details",
                            "Get detailed info about a specific cell including dependencies",
                            "Get details about cell F5 in the Sales sheet including its formula"
                                    + " and what it depends on.",
                            """
                            Cell F5 in Sales sheet:
                            - Type: Formula
                            - Formula: =SUM(F2:F4)
                            - Dependencies: F2, F3, F4
                            - F5 is the grand total summing the individual product totals"""),
                    TaskDefinition.of(
                            "cross_sheet_ref",
                            "Cross-Sheet Reference",
                            "Understand cross-sheet formula references",
                            "What does cell B4 in the Summary sheet reference? Show the formula"
                                    + " and its value.",
                            """
                            Cell B4 in Summary sheet:
                            - Formula: =Sales!F5
                            - This references the grand total from the Sales sheet
                            - Value: 178,300 (sum of all product totals)"""));

    // no ground truth, so these are never graded
    static final List<TaskDefinition> LARGE_FILE =
            List.of(
                    TaskDefinition.of(
                            "large_view",
                            "View Large Range",
                            "Display first 20 rows of a large dataset",
                            "Show the first 20 rows of data in the Data sheet.",
                            null),
                    TaskDefinition.of(
                            "large_stats",
                            "Large Statistics",
                            "Compute statistics on a large range",
                            "Calculate statistics for column B (B2:B1001) in the Data sheet.",
                            null),
                    TaskDefinition.of(
                            "large_search",
                            "Large Search",
                            "Search in a large file",
                            "Find the first 5 cells containing 'Row 500' in the workbook.",
                            null));
}
