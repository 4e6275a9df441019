package org.dxworks.exgraph.analyzer;

import org.dxworks.exgraph.model.CallKind;
import org.dxworks.exgraph.model.CallSite;
import org.dxworks.exgraph.model.FunctionSignature;
import org.dxworks.exgraph.model.Mfa;
import org.dxworks.exgraph.model.ModuleRecord;
import org.dxworks.exgraph.model.QualifiedName;
import org.dxworks.exgraph.model.ReferenceDirective;
import org.dxworks.exgraph.model.ReferenceKind;
import org.dxworks.exgraph.parser.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.exgraph.TestUtils.extract;
import static org.junit.jupiter.api.Assertions.*;

class ModuleExtractorTest {

    private static final QualifiedName M = QualifiedName.of("M");

    private static Mfa mfa(String module, String name, int arity) {
        return new Mfa(QualifiedName.parse(module), name, arity);
    }

    private static List<String> names(List<ModuleRecord> records) {
        return records.stream().map(r -> r.name.toString()).collect(Collectors.toList());
    }

    @Test
    void localCallToLaterFunction() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule M do\n"
                        + "  def a, do: b()\n"
                        + "  def b, do: :ok\n"
                        + "end\n");

        assertEquals(1, records.size());
        ModuleRecord m = records.get(0);
        assertEquals(M, m.name);
        assertEquals("test.ex", m.file);
        assertEquals(List.of(new FunctionSignature("a", 0), new FunctionSignature("b", 0)), m.functions);
        assertEquals(List.of(CallSite.local(mfa("M", "a", 0), mfa("M", "b", 0))), m.calls);
        assertTrue(m.refs.isEmpty());
    }

    @Test
    void functionsAreDeduplicatedAndSorted() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  defp z(x) when is_integer(x), do: x\n"
                        + "  defp z(_), do: nil\n"
                        + "  defmacro b(x, y) do\n"
                        + "    quote do: unquote(x) + unquote(y)\n"
                        + "  end\n"
                        + "  def a(x \\\\ 1), do: x\n"
                        + "  def b, do: 1\n"
                        + "end\n").get(0);

        assertEquals(List.of(
                new FunctionSignature("a", 1),
                new FunctionSignature("b", 0),
                new FunctionSignature("b", 2),
                new FunctionSignature("z", 1)), m.functions);
    }

    @Test
    void callsKeepPreOrder() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def run(x) do\n"
                        + "    a(b(c()), Enum.map(x, fn y -> d(y) end))\n"
                        + "    List.first(x)\n"
                        + "  end\n"
                        + "end\n").get(0);

        List<String> calls = m.calls.stream().map(c -> c.to.toString()).collect(Collectors.toList());
        assertEquals(List.of("M.a/2", "M.b/1", "M.c/0", "Enum.map/2", "M.d/1", "List.first/1"), calls);
        assertEquals(CallKind.LOCAL, m.calls.get(0).kind);
        assertEquals(CallKind.REMOTE, m.calls.get(3).kind);
    }

    @Test
    void repeatedCallsAreAllRecorded() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def a do\n"
                        + "    X.g()\n"
                        + "    X.g()\n"
                        + "  end\n"
                        + "end\n").get(0);

        assertEquals(2, m.calls.size());
        assertEquals(m.calls.get(0), m.calls.get(1));
    }

    @Test
    void variablesOperatorsAndDirectivesAreNotCalls() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def a(x) do\n"
                        + "    import Bitwise\n"
                        + "    y = x + 1\n"
                        + "    f = &inc/1\n"
                        + "    f.(y)\n"
                        + "  end\n"
                        + "end\n").get(0);

        assertTrue(m.calls.isEmpty(), m.calls.toString());
        assertEquals(List.of(new ReferenceDirective(ReferenceKind.IMPORT, QualifiedName.of("Bitwise"))), m.refs);
    }

    @Test
    void aliasInsideFunctionLeaksToLaterFunctions() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def a do\n"
                        + "    alias X.Y\n"
                        + "    Y.f()\n"
                        + "  end\n"
                        + "  def b, do: Y.g()\n"
                        + "end\n").get(0);

        assertEquals(mfa("X.Y", "f", 0), m.calls.get(0).to);
        assertEquals(mfa("X.Y", "g", 0), m.calls.get(1).to);
        assertEquals(List.of(new ReferenceDirective(ReferenceKind.ALIAS, QualifiedName.of("X", "Y"))), m.refs);
    }

    @Test
    void aliasesDoNotCrossModules() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule A do\n"
                        + "  alias X.Y\n"
                        + "end\n"
                        + "defmodule B do\n"
                        + "  def f, do: Y.g()\n"
                        + "end\n");

        assertEquals(mfa("Y", "g", 0), records.get(1).calls.get(0).to);
    }

    @Test
    void directivesAreRecordedInOrder() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  use GenServer\n"
                        + "  alias MyApp.{Repo, Accounts.User}\n"
                        + "  import Ecto.Query, only: [from: 2]\n"
                        + "  alias MyApp.Mailer, as: Mail\n"
                        + "  def send(u), do: Mail.deliver(User.email(u))\n"
                        + "end\n").get(0);

        assertEquals(List.of(
                new ReferenceDirective(ReferenceKind.USE, QualifiedName.of("GenServer")),
                new ReferenceDirective(ReferenceKind.ALIAS, QualifiedName.of("MyApp", "Repo")),
                new ReferenceDirective(ReferenceKind.ALIAS, QualifiedName.of("MyApp", "Accounts", "User")),
                new ReferenceDirective(ReferenceKind.IMPORT, QualifiedName.of("Ecto", "Query")),
                new ReferenceDirective(ReferenceKind.ALIAS, QualifiedName.of("MyApp", "Mailer"))), m.refs);
        assertEquals(mfa("MyApp.Mailer", "deliver", 1), m.calls.get(0).to);
        assertEquals(mfa("MyApp.Accounts.User", "email", 1), m.calls.get(1).to);
    }

    @Test
    void nestedModulesAreSeparateRecords() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule Outer do\n"
                        + "  defmodule Inner do\n"
                        + "    def f, do: :ok\n"
                        + "  end\n"
                        + "  defmodule Deep.Er do\n"
                        + "  end\n"
                        + "  def g, do: Inner.f()\n"
                        + "end\n"
                        + "defmodule Other do\n"
                        + "end\n");

        assertEquals(List.of("Outer", "Inner", "Deep.Er", "Other"), names(records));
        assertEquals(List.of(new FunctionSignature("g", 0)), records.get(0).functions);
        assertEquals(List.of(new FunctionSignature("f", 0)), records.get(1).functions);
        assertEquals(mfa("Inner", "f", 0), records.get(0).calls.get(0).to);
        assertTrue(records.get(0).refs.isEmpty());
    }

    @Test
    void nestedModuleKeepsExplicitAliasOfItsName() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule Outer do\n"
                        + "  alias Lib.Thing\n"
                        + "  defmodule Thing do\n"
                        + "  end\n"
                        + "  def g, do: Thing.f()\n"
                        + "end\n");

        assertEquals(List.of("Outer", "Thing"), names(records));
        assertEquals(mfa("Lib.Thing", "f", 0), records.get(0).calls.get(0).to);
    }

    @Test
    void moduleNameIgnoresEnclosingAliases() throws ParseException {
        List<ModuleRecord> records = extract(
                "defmodule Outer do\n"
                        + "  alias Lib.Thing\n"
                        + "  defmodule __MODULE__.Thing do\n"
                        + "  end\n"
                        + "  defmodule Thing.Sub do\n"
                        + "  end\n"
                        + "end\n");

        assertEquals(List.of("Outer", "Outer.Thing", "Thing.Sub"), names(records));
    }

    @Test
    void codeOutsideFunctionsIsNotACall() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  @timeout Application.get_env(:m, :timeout)\n"
                        + "  IO.puts(\"compiling\")\n"
                        + "  def t, do: @timeout\n"
                        + "end\n").get(0);

        assertTrue(m.calls.isEmpty());
        assertEquals(List.of(new FunctionSignature("t", 0)), m.functions);
    }

    @Test
    void dynamicTargetsResolveToUnknown() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def a(mod), do: mod.g()\n"
                        + "  def b, do: __MODULE__.a(1)\n"
                        + "  def c, do: :ets.new(:t, [])\n"
                        + "end\n").get(0);

        assertEquals(new Mfa(QualifiedName.UNKNOWN, "g", 0), m.calls.get(0).to);
        assertEquals(mfa("M", "a", 1), m.calls.get(1).to);
        assertEquals(mfa("ets", "new", 2), m.calls.get(2).to);
    }

    @Test
    void computedModuleNameIsUnknown() throws ParseException {
        ModuleRecord m = extract(
                "defmodule unquote(name) do\n"
                        + "  def f, do: g()\n"
                        + "end\n").get(0);

        assertEquals(QualifiedName.UNKNOWN, m.name);
        assertEquals(CallSite.local(new Mfa(QualifiedName.UNKNOWN, "f", 0), new Mfa(QualifiedName.UNKNOWN, "g", 0)),
                m.calls.get(0));
    }

    @Test
    void modulesInsideOtherConstructsAreFound() throws ParseException {
        List<ModuleRecord> records = extract(
                "if Code.ensure_loaded?(Jason) do\n"
                        + "  defmodule M.Encoder do\n"
                        + "    def encode(x), do: Jason.encode!(x)\n"
                        + "  end\n"
                        + "end\n");

        assertEquals(List.of("M.Encoder"), names(records));
        assertEquals(mfa("Jason", "encode!", 1), records.get(0).calls.get(0).to);
    }

    @Test
    void fileWithoutModulesYieldsNothing() throws ParseException {
        assertTrue(extract("IO.puts(\"script\")\nx = 1\n").isEmpty());
    }

    @Test
    void rescueAndElseSectionsAreWalked() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def run do\n"
                        + "    risky()\n"
                        + "  rescue\n"
                        + "    e in RuntimeError -> Logger.error(e)\n"
                        + "  after\n"
                        + "    cleanup()\n"
                        + "  end\n"
                        + "end\n").get(0);

        List<String> calls = m.calls.stream().map(c -> c.to.toString()).collect(Collectors.toList());
        assertEquals(List.of("M.risky/0", "Logger.error/1", "M.cleanup/0"), calls);
    }

    @Test
    void callsInsideParenthesizedGroupsAreRecorded() throws ParseException {
        ModuleRecord m = extract(
                "defmodule M do\n"
                        + "  def f(y) do\n"
                        + "    x = (prepare(); Store.load(y))\n"
                        + "    case x, do: (nil -> fallback(); v -> v)\n"
                        + "  end\n"
                        + "end\n").get(0);

        List<String> calls = m.calls.stream().map(c -> c.to.toString()).collect(Collectors.toList());
        assertEquals(List.of("M.prepare/0", "Store.load/1", "M.case/2", "M.fallback/0"), calls);
    }
}
