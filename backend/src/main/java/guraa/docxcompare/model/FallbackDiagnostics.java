package guraa.docxcompare.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FallbackDiagnostics {

    private List<AttemptDiagnostics> attempts = new ArrayList<>();
}
