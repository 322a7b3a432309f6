package translate;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import ir.QIRModule;
import qasm.QasmPrinter;
import qasm.ast.Program;
import translate.profile.BaseProfile;
import translate.profile.Profile;

/**
 * Module to OpenQASM 3 text. Each call translates with fresh state, so one
 * exporter can be reused across modules.
 */
public class QasmExporter {
    private final List<String> includes;
    private final Profile profile;

    public QasmExporter() {
        this(List.of(), new BaseProfile());
    }

    public QasmExporter(List<String> includes, Profile profile) {
        this.includes = List.copyOf(includes);
        this.profile = profile;
    }

    public Program build(QIRModule module) {
        return new QASM3Builder(module, includes, profile).buildProgram();
    }

    public String dumps(QIRModule module) {
        return QasmPrinter.getInstance().printToString(build(module));
    }

    public void dump(QIRModule module, Writer out) throws IOException {
        out.write(dumps(module));
        out.flush();
    }
}
