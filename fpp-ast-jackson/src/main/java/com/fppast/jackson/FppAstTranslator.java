package com.fppast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fppast.InternalAstError;
import com.fppast.InvalidFppToJsonFieldException;
import com.fppast.TranslationSession;
import com.fppast.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static com.fppast.jackson.JsonFields.annotatedList;
import static com.fppast.jackson.JsonFields.bool;
import static com.fppast.jackson.JsonFields.enumTag;
import static com.fppast.jackson.JsonFields.list;
import static com.fppast.jackson.JsonFields.node;
import static com.fppast.jackson.JsonFields.optional;
import static com.fppast.jackson.JsonFields.required;
import static com.fppast.jackson.JsonFields.string;
import static com.fppast.jackson.JsonFields.text;

/**
 * Rebuilds the typed FPP AST from a Jackson tree of fpp-to-json output.
 *
 * <p>Every decoded node keeps the id it had in the input, so it can be joined with the
 * location map. Decoding is a pure function of the input subtree: it draws no fresh ids and
 * never writes to the location registry.</p>
 *
 * <p>Failures are classified at each closed-union point:</p>
 * <ul>
 *   <li>{@link InvalidFppToJsonFieldException} for tags outside the family</li>
 *   <li>{@link com.fppast.NotSupportedInFppToJsonException} for include and location specifiers</li>
 *   <li>{@link InternalAstError} for shapes no well-formed producer emits</li>
 * </ul>
 */
public final class FppAstTranslator {

    private static final Logger log = LoggerFactory.getLogger(FppAstTranslator.class);

    private static final String SPEC_INCLUDE = "SpecInclude";

    private final TranslationSession session;

    private final VariantTable<AstNode<ModuleMember.Node>> moduleMember;
    private final VariantTable<AstNode<ComponentMember.Node>> componentMember;
    private final VariantTable<AstNode<StateMachineMember.Node>> stateMachineMember;
    private final VariantTable<AstNode<StateMember.Node>> stateMember;
    private final VariantTable<AstNode<InterfaceMember.Node>> interfaceMember;
    private final VariantTable<AstNode<TopologyMember.Node>> topologyMember;
    private final VariantTable<AstNode<TlmPacketSetMember.Node>> tlmPacketSetMember;
    private final VariantTable<AstNode<TlmPacketMember>> tlmPacketMember;
    private final VariantTable<SpecPortInstance> portInstance;
    private final VariantTable<SpecConnectionGraph> connectionGraph;
    private final VariantTable<TransitionOrDo> transitionOrDo;
    private final VariantTable<TypeName> typeName;
    private final VariantTable<Expr> expr;
    private final VariantTable<QualIdent> qualIdent;

    public FppAstTranslator(TranslationSession session) {
        this.session = session;

        moduleMember = new VariantTable<AstNode<ModuleMember.Node>>("module member")
            .on("DefAbsType", p -> member(p, this::defAbsType))
            .on("DefAliasType", p -> member(p, this::defAliasType))
            .on("DefArray", p -> member(p, this::defArray))
            .on("DefComponent", p -> member(p, this::defComponent))
            .on("DefComponentInstance", p -> member(p, this::defComponentInstance))
            .on("DefConstant", p -> member(p, this::defConstant))
            .on("DefEnum", p -> member(p, this::defEnum))
            .on("DefInterface", p -> member(p, this::defInterface))
            .on("DefModule", p -> member(p, this::defModule))
            .on("DefPort", p -> member(p, this::defPort))
            .on("DefStateMachine", p -> member(p, this::defStateMachine))
            .on("DefStruct", p -> member(p, this::defStruct))
            .on("DefTopology", p -> member(p, this::defTopology))
            .unsupported(SPEC_INCLUDE)
            .unsupported("SpecLoc");

        componentMember = new VariantTable<AstNode<ComponentMember.Node>>("component member")
            .on("DefAbsType", p -> member(p, this::defAbsType))
            .on("DefAliasType", p -> member(p, this::defAliasType))
            .on("DefArray", p -> member(p, this::defArray))
            .on("DefConstant", p -> member(p, this::defConstant))
            .on("DefEnum", p -> member(p, this::defEnum))
            .on("DefStateMachine", p -> member(p, this::defStateMachine))
            .on("DefStruct", p -> member(p, this::defStruct))
            .on("SpecCommand", p -> member(p, this::specCommand))
            .on("SpecContainer", p -> member(p, this::specContainer))
            .on("SpecEvent", p -> member(p, this::specEvent))
            .on("SpecImportInterface", p -> member(p, this::specImport))
            .on("SpecInternalPort", p -> member(p, this::specInternalPort))
            .on("SpecParam", p -> member(p, this::specParam))
            .on("SpecPortInstance", p -> member(p, this::specPortInstance))
            .on("SpecPortMatching", p -> member(p, this::specPortMatching))
            .on("SpecRecord", p -> member(p, this::specRecord))
            .on("SpecStateMachineInstance", p -> member(p, this::specStateMachineInstance))
            .on("SpecTlmChannel", p -> member(p, this::specTlmChannel))
            .unsupported(SPEC_INCLUDE);

        stateMachineMember = new VariantTable<AstNode<StateMachineMember.Node>>("state machine member")
            .on("DefAction", p -> member(p, this::defAction))
            .on("DefChoice", p -> member(p, this::defChoice))
            .on("DefGuard", p -> member(p, this::defGuard))
            .on("DefSignal", p -> member(p, this::defSignal))
            .on("DefState", p -> member(p, this::defState))
            .on("SpecInitialTransition", p -> member(p, this::specInitialTransition));

        stateMember = new VariantTable<AstNode<StateMember.Node>>("state member")
            .on("DefChoice", p -> member(p, this::defChoice))
            .on("DefState", p -> member(p, this::defState))
            .on("SpecStateEntry", p -> member(p, this::specStateEntry))
            .on("SpecStateExit", p -> member(p, this::specStateExit))
            .on("SpecInitialTransition", p -> member(p, this::specInitialTransition))
            .on("SpecStateTransition", p -> member(p, this::specStateTransition));

        interfaceMember = new VariantTable<AstNode<InterfaceMember.Node>>("interface member")
            .on("SpecPortInstance", p -> member(p, this::specPortInstance))
            .on("SpecImportInterface", p -> member(p, this::specImport));

        topologyMember = new VariantTable<AstNode<TopologyMember.Node>>("topology member")
            .on("SpecCompInstance", p -> member(p, this::specCompInstance))
            .on("SpecConnectionGraph", p -> member(p, this::specConnectionGraph))
            .on("SpecTlmPacketSet", p -> member(p, this::specTlmPacketSet))
            .on("SpecTopImport", p -> member(p, this::specImport))
            .unsupported(SPEC_INCLUDE);

        tlmPacketSetMember = new VariantTable<AstNode<TlmPacketSetMember.Node>>("telemetry packet set member")
            .on("SpecTlmPacket", p -> member(p, this::specTlmPacket))
            .unsupported(SPEC_INCLUDE);

        tlmPacketMember = new VariantTable<AstNode<TlmPacketMember>>("telemetry packet member")
            .on("TlmChannelIdentifier", p -> member(p, this::tlmChannelIdentifier))
            .unsupported(SPEC_INCLUDE);

        portInstance = new VariantTable<SpecPortInstance>("port instance")
            .on("General", this::general)
            .on("Special", this::special);

        connectionGraph = new VariantTable<SpecConnectionGraph>("connection graph")
            .on("Direct", this::direct)
            .on("Pattern", this::pattern);

        transitionOrDo = new VariantTable<TransitionOrDo>("transition or do")
            .on("Transition", p -> new TransitionOrDo.Transition(node(required(p, "transition"), this::transitionExpr)))
            .on("Do", p -> new TransitionOrDo.Do(identList(required(p, "actions"))));

        typeName = new VariantTable<TypeName>("type name")
            .on("TypeNameBool", p -> new TypeNameBool())
            .on("TypeNameFloat", p -> new TypeNameFloat(enumTag(required(p, "name"), FloatType.class)))
            .on("TypeNameInt", p -> new TypeNameInt(enumTag(required(p, "name"), IntType.class)))
            .on("TypeNameQualIdent", p -> new TypeNameQualIdent(qualIdent(required(p, "name"))))
            .on("TypeNameString", p -> new TypeNameString(optional(p, "size", this::expr)));

        expr = new VariantTable<Expr>("expression")
            .on("ExprArray", p -> new ExprArray(list(required(p, "elts"), this::expr)))
            .on("ExprBinop", p -> new ExprBinop(
                expr(required(p, "e1")),
                enumTag(required(p, "op"), Binop.class),
                expr(required(p, "e2"))))
            .on("ExprDot", p -> new ExprDot(expr(required(p, "e")), ident(required(p, "id"))))
            .on("ExprIdent", p -> new ExprIdent(string(p, "value")))
            .on("ExprLiteralBool", p -> new ExprLiteralBool(enumTag(required(p, "value"), LiteralBool.class)))
            .on("ExprLiteralFloat", p -> new ExprLiteralFloat(string(p, "value")))
            .on("ExprLiteralInt", p -> new ExprLiteralInt(string(p, "value")))
            .on("ExprLiteralString", p -> new ExprLiteralString(string(p, "value")))
            .on("ExprParen", p -> new ExprParen(expr(required(p, "e"))))
            .on("ExprStruct", p -> new ExprStruct(list(required(p, "members"), n -> node(n, this::structMember))))
            .on("ExprUnop", p -> new ExprUnop(enumTag(required(p, "op"), Unop.class), expr(required(p, "e"))));

        qualIdent = new VariantTable<QualIdent>("qualified identifier")
            .on("Unqualified", p -> new QualIdent.Unqualified(string(p, "name")))
            .on("Qualified", p -> new QualIdent.Qualified(qualIdent(required(p, "qualifier")), ident(required(p, "name"))));
    }

    // ==================== Entry points ====================

    /**
     * Translates a whole fpp-to-json AST document: an array of {@code {"members": [...]}} objects.
     */
    public List<TransUnit> translateTransUnits(JsonNode root) {
        List<TransUnit> units = list(root, this::transUnit);
        log.debug("Translated {} translation unit(s)", units.size());
        return units;
    }

    /**
     * Translates one translation unit: a single-key object whose value is the list of annotated
     * module members. The key itself carries no meaning.
     */
    public TransUnit transUnit(JsonNode tagged) {
        Map.Entry<String, JsonNode> unit = JsonFields.variant(tagged, "translation unit");
        List<ModuleMember> members = moduleMembers(unit.getValue());
        log.debug("Translated translation unit '{}' with {} member(s)", unit.getKey(), members.size());
        return new TransUnit(members);
    }

    public List<ModuleMember> moduleMembers(JsonNode array) {
        return members(array, moduleMember, ModuleMember::new);
    }

    public List<ComponentMember> componentMembers(JsonNode array) {
        return members(array, componentMember, ComponentMember::new);
    }

    public List<StateMachineMember> stateMachineMembers(JsonNode array) {
        return members(array, stateMachineMember, StateMachineMember::new);
    }

    public List<StateMember> stateMembers(JsonNode array) {
        return members(array, stateMember, StateMember::new);
    }

    public List<InterfaceMember> interfaceMembers(JsonNode array) {
        return members(array, interfaceMember, InterfaceMember::new);
    }

    public List<TopologyMember> topologyMembers(JsonNode array) {
        return members(array, topologyMember, TopologyMember::new);
    }

    public List<TlmPacketSetMember> tlmPacketSetMembers(JsonNode array) {
        return members(array, tlmPacketSetMember, TlmPacketSetMember::new);
    }

    public List<AstNode<TlmPacketMember>> tlmPacketMembers(JsonNode array) {
        return list(array, tlmPacketMember::decode);
    }

    public AstNode<Expr> expr(JsonNode wrapper) {
        return node(wrapper, expr::decode);
    }

    public AstNode<TypeName> typeName(JsonNode wrapper) {
        return node(wrapper, typeName::decode);
    }

    public AstNode<QualIdent> qualIdent(JsonNode wrapper) {
        return node(wrapper, qualIdent::decode);
    }

    public AstNode<String> ident(JsonNode wrapper) {
        return node(wrapper, data -> text(data, "identifier"));
    }

    // ==================== Shared helpers ====================

    private <N, M> List<M> members(JsonNode array, VariantTable<AstNode<N>> table, Function<Annotated<AstNode<N>>, M> wrap) {
        List<Annotated<AstNode<N>>> annotated = annotatedList(array, table::decode, session.parallelMembers());
        return annotated.stream().map(wrap).toList();
    }

    /**
     * Member variants carry their node under {@code "node"}.
     */
    private static <T> AstNode<T> member(JsonNode payload, Function<JsonNode, ? extends T> decoder) {
        return node(required(payload, "node"), decoder);
    }

    private List<AstNode<String>> identList(JsonNode array) {
        return list(array, this::ident);
    }

    private AstNode<String> stringNode(JsonNode wrapper) {
        return node(wrapper, data -> text(data, "string"));
    }

    private List<Annotated<AstNode<FormalParam>>> formalParams(JsonNode array) {
        return annotatedList(array, n -> node(n, this::formalParam));
    }

    private FormalParam formalParam(JsonNode d) {
        return new FormalParam(
            enumTag(required(d, "kind"), FormalParam.Kind.class),
            string(d, "name"),
            typeName(required(d, "typeName")));
    }

    private AstNode<QueueFull> queueFullNode(JsonNode wrapper) {
        return node(wrapper, data -> enumTag(data, QueueFull.class));
    }

    private Optional<AstNode<TypeName>> optionalTypeName(JsonNode d) {
        return optional(d, "typeName", this::typeName);
    }

    // ==================== Definitions ====================

    private DefAbsType defAbsType(JsonNode d) {
        return new DefAbsType(string(d, "name"));
    }

    private DefAliasType defAliasType(JsonNode d) {
        return new DefAliasType(string(d, "name"), typeName(required(d, "typeName")));
    }

    private DefArray defArray(JsonNode d) {
        return new DefArray(
            string(d, "name"),
            expr(required(d, "size")),
            typeName(required(d, "eltType")),
            optional(d, "default", this::expr),
            optional(d, "format", this::stringNode));
    }

    private DefComponent defComponent(JsonNode d) {
        return new DefComponent(
            enumTag(required(d, "kind"), ComponentKind.class),
            string(d, "name"),
            componentMembers(required(d, "members")));
    }

    private DefComponentInstance defComponentInstance(JsonNode d) {
        return new DefComponentInstance(
            string(d, "name"),
            qualIdent(required(d, "component")),
            expr(required(d, "baseId")),
            optional(d, "implType", this::stringNode),
            optional(d, "file", this::stringNode),
            optional(d, "queueSize", this::expr),
            optional(d, "stackSize", this::expr),
            optional(d, "priority", this::expr),
            optional(d, "cpu", this::expr),
            annotatedList(required(d, "initSpecs"), n -> node(n, this::specInit)));
    }

    private SpecInit specInit(JsonNode d) {
        return new SpecInit(expr(required(d, "phase")), string(d, "code"));
    }

    private DefConstant defConstant(JsonNode d) {
        return new DefConstant(string(d, "name"), expr(required(d, "value")));
    }

    private DefEnum defEnum(JsonNode d) {
        return new DefEnum(
            string(d, "name"),
            optionalTypeName(d),
            annotatedList(required(d, "constants"), n -> node(n, this::defEnumConstant)),
            optional(d, "default", this::expr));
    }

    private DefEnumConstant defEnumConstant(JsonNode d) {
        return new DefEnumConstant(string(d, "name"), optional(d, "value", this::expr));
    }

    private DefInterface defInterface(JsonNode d) {
        return new DefInterface(string(d, "name"), interfaceMembers(required(d, "members")));
    }

    private DefModule defModule(JsonNode d) {
        return new DefModule(string(d, "name"), moduleMembers(required(d, "members")));
    }

    private DefPort defPort(JsonNode d) {
        return new DefPort(
            string(d, "name"),
            formalParams(required(d, "params")),
            optional(d, "returnType", this::typeName));
    }

    private DefStateMachine defStateMachine(JsonNode d) {
        return new DefStateMachine(string(d, "name"), optional(d, "members", this::stateMachineMembers));
    }

    private DefStruct defStruct(JsonNode d) {
        return new DefStruct(
            string(d, "name"),
            annotatedList(required(d, "members"), n -> node(n, this::structTypeMember)),
            optional(d, "default", this::expr));
    }

    private StructTypeMember structTypeMember(JsonNode d) {
        return new StructTypeMember(
            string(d, "name"),
            optional(d, "size", this::expr),
            typeName(required(d, "typeName")),
            optional(d, "format", this::stringNode));
    }

    private DefTopology defTopology(JsonNode d) {
        return new DefTopology(string(d, "name"), topologyMembers(required(d, "members")));
    }

    private DefAction defAction(JsonNode d) {
        return new DefAction(string(d, "name"), optionalTypeName(d));
    }

    private DefChoice defChoice(JsonNode d) {
        return new DefChoice(
            string(d, "name"),
            ident(required(d, "guard")),
            node(required(d, "ifTransition"), this::transitionExpr),
            node(required(d, "elseTransition"), this::transitionExpr));
    }

    private DefGuard defGuard(JsonNode d) {
        return new DefGuard(string(d, "name"), optionalTypeName(d));
    }

    private DefSignal defSignal(JsonNode d) {
        return new DefSignal(string(d, "name"), optionalTypeName(d));
    }

    private DefState defState(JsonNode d) {
        return new DefState(string(d, "name"), stateMembers(required(d, "members")));
    }

    // ==================== Component specifiers ====================

    private SpecCommand specCommand(JsonNode d) {
        return new SpecCommand(
            enumTag(required(d, "kind"), SpecCommand.Kind.class),
            string(d, "name"),
            formalParams(required(d, "params")),
            optional(d, "opcode", this::expr),
            optional(d, "priority", this::expr),
            optional(d, "queueFull", this::queueFullNode));
    }

    private SpecContainer specContainer(JsonNode d) {
        return new SpecContainer(
            string(d, "name"),
            optional(d, "id", this::expr),
            optional(d, "defaultPriority", this::expr));
    }

    private SpecEvent specEvent(JsonNode d) {
        return new SpecEvent(
            string(d, "name"),
            formalParams(required(d, "params")),
            enumTag(required(d, "severity"), SpecEvent.Severity.class),
            optional(d, "id", this::expr),
            stringNode(required(d, "format")),
            optional(d, "throttle", this::expr));
    }

    private SpecInternalPort specInternalPort(JsonNode d) {
        return new SpecInternalPort(
            string(d, "name"),
            formalParams(required(d, "params")),
            optional(d, "priority", this::expr),
            optional(d, "queueFull", n -> enumTag(n, QueueFull.class)));
    }

    private SpecParam specParam(JsonNode d) {
        return new SpecParam(
            string(d, "name"),
            typeName(required(d, "typeName")),
            optional(d, "default", this::expr),
            optional(d, "id", this::expr),
            optional(d, "setOpcode", this::expr),
            optional(d, "saveOpcode", this::expr),
            bool(d, "isExternal"));
    }

    private SpecPortInstance specPortInstance(JsonNode d) {
        return portInstance.decode(d);
    }

    private SpecPortInstance.General general(JsonNode p) {
        return new SpecPortInstance.General(
            enumTag(required(p, "kind"), GeneralKind.class),
            string(p, "name"),
            optional(p, "size", this::expr),
            optional(p, "port", this::qualIdent),
            optional(p, "priority", this::expr),
            optional(p, "queueFull", this::queueFullNode));
    }

    private SpecPortInstance.Special special(JsonNode p) {
        return new SpecPortInstance.Special(
            optional(p, "inputKind", n -> enumTag(n, SpecialInputKind.class)),
            enumTag(required(p, "kind"), SpecialKind.class),
            string(p, "name"),
            optional(p, "priority", this::expr),
            optional(p, "queueFull", this::queueFullNode));
    }

    private SpecPortMatching specPortMatching(JsonNode d) {
        return new SpecPortMatching(ident(required(d, "port1")), ident(required(d, "port2")));
    }

    private SpecRecord specRecord(JsonNode d) {
        return new SpecRecord(
            string(d, "name"),
            typeName(required(d, "recordType")),
            bool(d, "isArray"),
            optional(d, "id", this::expr));
    }

    private SpecStateMachineInstance specStateMachineInstance(JsonNode d) {
        return new SpecStateMachineInstance(
            string(d, "name"),
            qualIdent(required(d, "stateMachine")),
            optional(d, "priority", this::expr),
            optional(d, "queueFull", n -> enumTag(n, QueueFull.class)));
    }

    private SpecTlmChannel specTlmChannel(JsonNode d) {
        return new SpecTlmChannel(
            string(d, "name"),
            typeName(required(d, "typeName")),
            optional(d, "id", this::expr),
            optional(d, "update", n -> enumTag(n, SpecTlmChannel.Update.class)),
            optional(d, "format", this::stringNode),
            list(required(d, "low"), this::limit),
            list(required(d, "high"), this::limit));
    }

    /**
     * A limit is a two-element array: {@code [kindNode, exprNode]}.
     */
    private Limit limit(JsonNode pair) {
        if (!pair.isArray() || pair.size() != 2) {
            throw new InternalAstError("expected a [kind, value] limit but found " + pair);
        }
        return new Limit(node(pair.get(0), n -> enumTag(n, LimitKind.class)), expr(pair.get(1)));
    }

    private SpecImport specImport(JsonNode d) {
        return new SpecImport(qualIdent(required(d, "sym")));
    }

    // ==================== Topology specifiers ====================

    private SpecCompInstance specCompInstance(JsonNode d) {
        return new SpecCompInstance(
            enumTag(required(d, "visibility"), Visibility.class),
            qualIdent(required(d, "instance")));
    }

    private SpecConnectionGraph specConnectionGraph(JsonNode d) {
        return connectionGraph.decode(d);
    }

    private SpecConnectionGraph.Direct direct(JsonNode p) {
        return new SpecConnectionGraph.Direct(string(p, "name"), list(required(p, "connections"), this::connection));
    }

    private Connection connection(JsonNode c) {
        return new Connection(
            bool(c, "isUnmatched"),
            node(required(c, "fromPort"), this::portInstanceIdentifier),
            optional(c, "fromIndex", this::expr),
            node(required(c, "toPort"), this::portInstanceIdentifier),
            optional(c, "toIndex", this::expr));
    }

    private PortInstanceIdentifier portInstanceIdentifier(JsonNode d) {
        return new PortInstanceIdentifier(qualIdent(required(d, "componentInstance")), ident(required(d, "portName")));
    }

    private SpecConnectionGraph.Pattern pattern(JsonNode p) {
        return new SpecConnectionGraph.Pattern(
            enumTag(required(p, "kind"), PatternKind.class),
            qualIdent(required(p, "source")),
            list(required(p, "targets"), this::qualIdent));
    }

    private SpecTlmPacketSet specTlmPacketSet(JsonNode d) {
        return new SpecTlmPacketSet(
            string(d, "name"),
            tlmPacketSetMembers(required(d, "members")),
            list(required(d, "omitted"), n -> node(n, this::tlmChannelIdentifier)));
    }

    private SpecTlmPacket specTlmPacket(JsonNode d) {
        return new SpecTlmPacket(
            string(d, "name"),
            optional(d, "id", this::expr),
            expr(required(d, "group")),
            tlmPacketMembers(required(d, "members")));
    }

    private TlmChannelIdentifier tlmChannelIdentifier(JsonNode d) {
        return new TlmChannelIdentifier(qualIdent(required(d, "componentInstance")), ident(required(d, "channelName")));
    }

    // ==================== State machine specifiers ====================

    private SpecInitialTransition specInitialTransition(JsonNode d) {
        return new SpecInitialTransition(node(required(d, "transition"), this::transitionExpr));
    }

    private SpecStateEntry specStateEntry(JsonNode d) {
        return new SpecStateEntry(identList(required(d, "actions")));
    }

    private SpecStateExit specStateExit(JsonNode d) {
        return new SpecStateExit(identList(required(d, "actions")));
    }

    private SpecStateTransition specStateTransition(JsonNode d) {
        return new SpecStateTransition(
            ident(required(d, "signal")),
            optional(d, "guard", this::ident),
            transitionOrDo.decode(required(d, "transitionOrDo")));
    }

    private TransitionExpr transitionExpr(JsonNode d) {
        return new TransitionExpr(identList(required(d, "actions")), qualIdent(required(d, "target")));
    }

    // ==================== Expressions ====================

    private StructMember structMember(JsonNode d) {
        return new StructMember(string(d, "name"), expr(required(d, "value")));
    }
}
