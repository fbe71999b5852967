package com.ClaimFlow.expense_backend.service.analysis;

import com.ClaimFlow.expense_backend.enums.ExpenseCategory;
import com.ClaimFlow.expense_backend.enums.TravelMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class BillPromptBuilder {

    private static final DateTimeFormatter INDIAN_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private static final Map<ExpenseCategory, String> CATEGORY_GUIDANCE = new EnumMap<>(ExpenseCategory.class);

    static {
        CATEGORY_GUIDANCE.put(ExpenseCategory.TRAVEL,
                "This is a travel ticket or fare receipt. Extract the travel mode (bus, train, cab, "
                        + "flight_economy, flight_business, own_vehicle) and the route as \"FROM - TO\". "
                        + "Check that the mode is allowed for the employee's grade.");
        CATEGORY_GUIDANCE.put(ExpenseCategory.FOOD,
                "This is a restaurant or food bill. Check for itemisation, GST details and that the "
                        + "total matches the sum of items.");
        CATEGORY_GUIDANCE.put(ExpenseCategory.ACCOMMODATION,
                "This is a hotel or lodging invoice. Check for guest name, stay dates, GST number "
                        + "and the per-night tariff.");
        CATEGORY_GUIDANCE.put(ExpenseCategory.MEDICAL,
                "This is a pharmacy, clinic or hospital bill. Check for the provider's registration "
                        + "details, patient name and itemised charges.");
        CATEGORY_GUIDANCE.put(ExpenseCategory.COMMUNICATION,
                "This is a phone, mobile or internet bill. Check the billing period, account number "
                        + "and provider name.");
        CATEGORY_GUIDANCE.put(ExpenseCategory.OTHER,
                "This is a general business expense bill. Check that the vendor and purpose are clear.");
    }

    private final Clock clock;

    public String build(ClaimContext context) {
        LocalDate today = LocalDate.now(clock);
        StringBuilder prompt = new StringBuilder();

        prompt.append("You are an expert expense auditor analysing a bill for an expense reimbursement claim.\n\n");

        prompt.append("DATE FORMAT:\n")
                .append("- Indian bills use DD/MM/YY or DD/MM/YYYY (day first).\n")
                .append("- Today's date is ").append(today.format(INDIAN_DATE))
                .append(" (").append(today).append(").\n")
                .append("- Return bill_date as YYYY-MM-DD. Only flag a future date if it is in the future ")
                .append("after day-first parsing.\n\n");

        prompt.append("CATEGORY GUIDANCE:\n")
                .append(CATEGORY_GUIDANCE.get(context.getCategory())).append("\n\n");

        prompt.append("CLAIM DETAILS:\n")
                .append("- Category: ").append(context.getCategory().getValue()).append('\n')
                .append("- Claimed amount: ").append(context.getCurrency()).append(' ')
                .append(context.getAmount().toPlainString()).append('\n')
                .append("- Expense date: ").append(context.getExpenseDate()).append('\n')
                .append("- Description: ").append(context.getDescription()).append('\n')
                .append("- Employee grade: ").append(context.getGrade()).append('\n');
        if (context.getTravelMode() != null) {
            prompt.append("- Declared travel mode: ").append(context.getTravelMode().getValue()).append('\n');
        }
        prompt.append('\n');

        prompt.append("GRADE RULES:\n");
        if (context.getCategoryLimit() != null) {
            prompt.append("- Maximum amount for this category: ").append(context.getCurrency()).append(' ')
                    .append(context.getCategoryLimit().toPlainString()).append('\n');
        } else {
            prompt.append("- No limit is configured for this category and grade.\n");
        }
        if (context.getCategory() == ExpenseCategory.TRAVEL && context.getAllowedTravelModes() != null) {
            prompt.append("- Allowed travel modes: ").append(context.getAllowedTravelModes().stream()
                    .sorted(Comparator.naturalOrder())
                    .map(TravelMode::getValue)
                    .collect(Collectors.joining(", "))).append('\n');
        }
        prompt.append('\n');

        prompt.append("Return ONLY a JSON object with exactly these keys:\n")
                .append("{\n")
                .append("  \"is_authentic\": true/false,\n")
                .append("  \"confidence_score\": 0-100,\n")
                .append("  \"bill_number\": \"string or null\",\n")
                .append("  \"bill_date\": \"YYYY-MM-DD or null\",\n")
                .append("  \"vendor_name\": \"string or null\",\n")
                .append("  \"extracted_amount\": number or null,\n")
                .append("  \"has_gst\": true/false/null,\n")
                .append("  \"travel_mode\": \"string or null\",\n")
                .append("  \"travel_route\": \"FROM - TO or null\",\n")
                .append("  \"red_flags\": [\"suspicious elements\"],\n")
                .append("  \"missing_elements\": [\"missing required elements\"],\n")
                .append("  \"recommendation\": \"APPROVE/REJECT/REVIEW\",\n")
                .append("  \"recommendation_reason\": \"string\",\n")
                .append("  \"summary\": \"one or two lines\"\n")
                .append("}\n\n")
                .append("Key checks: does the bill amount match the claimed amount, is the bill authentic, ")
                .append("are the required details visible, and is the claim within the grade rules.\n")
                .append("Return only the JSON, no other text.");

        return prompt.toString();
    }
}
